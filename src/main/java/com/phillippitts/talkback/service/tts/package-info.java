/**
 * Text-to-speech side of a turn: the synthesizer port and the chunker that decides
 * which generated text is ready to be spoken.
 */
package com.phillippitts.talkback.service.tts;
