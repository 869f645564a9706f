/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.avifconverter.exception.AvifConverterException} - Base exception</li>
 *   <li>{@link com.phillippitts.avifconverter.exception.UnsupportedFormatException} - Declared
 *       format is not jpeg or heic (client error)</li>
 *   <li>{@link com.phillippitts.avifconverter.exception.ToolNotFoundException} - Codec executable
 *       missing on the host (environment error)</li>
 *   <li>{@link com.phillippitts.avifconverter.exception.ScratchAreaException} - Scratch directory
 *       cannot be created (environment error)</li>
 *   <li>{@link com.phillippitts.avifconverter.exception.StageExecutionException} - A stage could
 *       not be run to completion</li>
 *   <li>{@link com.phillippitts.avifconverter.exception.ArtifactIOException} - Artifact read/write
 *       failed independently of the tool</li>
 *   <li>{@link com.phillippitts.avifconverter.exception.ConversionFailedException} - Carries a
 *       classified failure outcome to the HTTP boundary</li>
 *   <li>{@link com.phillippitts.avifconverter.exception.ConverterBusyException} - No conversion
 *       permit available in time</li>
 * </ul>
 *
 * <p>The orchestrator catches these internally and returns them as classified
 * {@link com.phillippitts.avifconverter.domain.ConversionFailure} values; only the HTTP layer
 * throws across its boundary, where {@code GlobalExceptionHandler} maps them to status codes.
 *
 * @since 1.0
 */
package com.phillippitts.avifconverter.exception;
