/**
 * Immutable values shared by the relay, the session client and the engines:
 * {@link com.phillippitts.scriberelay.domain.AudioFrame},
 * {@link com.phillippitts.scriberelay.domain.TranscriptFragment} and
 * {@link com.phillippitts.scriberelay.domain.SessionStats}.
 */
package com.phillippitts.scriberelay.domain;
