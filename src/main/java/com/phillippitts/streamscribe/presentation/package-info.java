/**
 * Entry points that drive the application from the outside.
 *
 * <p>{@code StreamingRunner} runs a single
 * streaming session from the command line.
 */
package com.phillippitts.streamscribe.presentation;
