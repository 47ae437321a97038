/**
 * REST controllers.
 */
package com.phillippitts.talkback.presentation.controller;
