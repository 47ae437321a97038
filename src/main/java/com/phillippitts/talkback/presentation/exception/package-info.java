/**
 * Translation of domain exceptions into HTTP responses.
 */
package com.phillippitts.talkback.presentation.exception;
