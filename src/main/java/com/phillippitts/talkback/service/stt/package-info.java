/**
 * Speech-to-text collaborator port.
 */
package com.phillippitts.talkback.service.stt;
