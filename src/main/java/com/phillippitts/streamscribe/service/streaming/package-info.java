/**
 * The live streaming pipeline.
 *
 * <p>Data flow for one run:
 * <pre>
 * FrameSource → BoundedFrameChannel → ChunkPump → Session
 * Session → ResultReceiver → OutputSink
 * </pre>
 *
 * <p>{@link com.phillippitts.streamscribe.service.streaming.StreamingPipeline} owns a run;
 * {@link com.phillippitts.streamscribe.service.streaming.ShutdownCoordinator} owns its
 * cancellation and ordered stop sequence. The loops share one
 * {@link com.phillippitts.streamscribe.service.streaming.PipelineFlags} instance and observe it
 * at iteration boundaries only.
 */
package com.phillippitts.streamscribe.service.streaming;
