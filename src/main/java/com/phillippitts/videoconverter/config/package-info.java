/**
 * Spring configuration: bound properties, the normalized
 * {@link com.phillippitts.videoconverter.config.ConverterSettings}, thread pools and bean wiring.
 */
package com.phillippitts.videoconverter.config;
