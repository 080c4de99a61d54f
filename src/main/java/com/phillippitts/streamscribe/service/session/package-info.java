/**
 * Client side of the remote real-time transcription service: session creation and closing
 * over HTTP, audio and results over a WebSocket stream.
 */
package com.phillippitts.streamscribe.service.session;
