/**
 * Binary event-stream framing (length-prefixed, CRC32-checked, string headers) and the parser
 * for transcript events carried inside it.
 */
package com.phillippitts.scriberelay.codec;
