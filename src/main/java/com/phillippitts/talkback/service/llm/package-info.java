/**
 * Text generation collaborator port.
 */
package com.phillippitts.talkback.service.llm;
