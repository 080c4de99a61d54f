/**
 * Audio format and microphone capture.
 *
 * <p>Audio is raw signed little-endian PCM. {@link com.phillippitts.streamscribe.service.audio.AudioFormat}
 * derives block and chunk sizes from the configured format; the {@code capture} subpackage
 * delivers fixed-size frames from the device on a dedicated thread.
 */
package com.phillippitts.streamscribe.service.audio;
