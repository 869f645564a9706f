package com.phillippitts.avifconverter.presentation.controller;

import com.phillippitts.avifconverter.domain.ArtifactRole;
import com.phillippitts.avifconverter.domain.ConversionOutcome;
import com.phillippitts.avifconverter.domain.ConversionRequest;
import com.phillippitts.avifconverter.domain.ConversionResult;
import com.phillippitts.avifconverter.domain.ImageFormat;
import com.phillippitts.avifconverter.exception.ArtifactIOException;
import com.phillippitts.avifconverter.exception.ConversionFailedException;
import com.phillippitts.avifconverter.exception.UnsupportedFormatException;
import com.phillippitts.avifconverter.presentation.dto.ConversionResponse;
import com.phillippitts.avifconverter.service.concurrency.ConversionPermits;
import com.phillippitts.avifconverter.service.orchestration.ConversionOrchestrator;
import com.phillippitts.avifconverter.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Upload endpoint: one JPEG or HEIC image in, one AVIF out.
 *
 * <p>The declared format comes from the part's content type, with the filename extension as a
 * fallback for generic types. Failures surface as exceptions and are rendered by
 * {@code GlobalExceptionHandler}.
 */
@RestController
class ConvertController {

    private static final Logger LOG = LogManager.getLogger(ConvertController.class);
    private static final String AVIF_EXTENSION = "avif";

    private final ConversionOrchestrator orchestrator;
    private final ConversionPermits permits;

    ConvertController(ConversionOrchestrator orchestrator, ConversionPermits permits) {
        this.orchestrator = orchestrator;
        this.permits = permits;
    }

    @PostMapping(path = "/convert", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<ConversionResponse> convert(@RequestParam("image") MultipartFile image) {
        String filename = image.getOriginalFilename();
        ImageFormat format = ImageFormat.fromUpload(image.getContentType(), filename)
                .orElseThrow(() -> new UnsupportedFormatException(String.valueOf(image.getContentType())));

        byte[] data;
        try {
            data = image.getBytes();
        } catch (IOException e) {
            throw new ArtifactIOException(ArtifactRole.INPUT, null, "Could not read uploaded image", e);
        }
        LOG.info("Upload received: {} ({} bytes, {})", LogSanitizer.filename(filename), data.length, format.tag());

        ConversionOutcome outcome;
        permits.acquire();
        try {
            outcome = orchestrator.convert(new ConversionRequest(data, format.tag(), filename));
        } finally {
            permits.release();
        }

        if (!outcome.isSuccess()) {
            throw new ConversionFailedException(outcome.failure());
        }
        ConversionResult result = outcome.result();
        String outputName = LogSanitizer.replaceExtension(filename, AVIF_EXTENSION);
        return ResponseEntity.ok(ConversionResponse.from(result, outputName));
    }
}
