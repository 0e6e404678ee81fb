/**
 * Hardware encoder detection.
 *
 * <p>Tiers are probed in order (NVENC, Quick Sync, VAAPI) with external query tools;
 * the first backend that answers is used for every conversion, libx264 otherwise.
 */
package com.phillippitts.videoconverter.service.encoder;
