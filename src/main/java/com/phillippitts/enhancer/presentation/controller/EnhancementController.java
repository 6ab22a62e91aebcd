package com.phillippitts.enhancer.presentation.controller;

import com.phillippitts.enhancer.config.logging.MdcFilter;
import com.phillippitts.enhancer.domain.EnhancementRequest;
import com.phillippitts.enhancer.domain.ImageFormat;
import com.phillippitts.enhancer.domain.Operation;
import com.phillippitts.enhancer.domain.ProcessingResult;
import com.phillippitts.enhancer.domain.UpscaleMode;
import com.phillippitts.enhancer.domain.UpscaleOption;
import com.phillippitts.enhancer.exception.InvalidRequestException;
import com.phillippitts.enhancer.service.dispatch.EnhancementDispatcher;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Entry point for the collaborator layer: turns a JSON body into an
 * {@link EnhancementRequest} and runs it on the worker pool.
 *
 * <p>200 on success, 422 when processing failed, 503 when the pool is at capacity.
 */
@RestController
@RequestMapping("/api")
class EnhancementController {

    private static final Logger LOG = LogManager.getLogger(EnhancementController.class);

    private final EnhancementDispatcher dispatcher;

    EnhancementController(EnhancementDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping("/enhance")
    ResponseEntity<EnhanceResponse> enhance(@Valid @RequestBody EnhanceRequestBody body,
                                            @RequestHeader(value = MdcFilter.REQUESTER_HEADER, required = false)
                                            String requesterHeader) {
        EnhancementRequest request = toRequest(body, requesterHeader);
        LOG.info("Enhance requested: operation={}, source={}", request.operation(), request.source().getFileName());
        ProcessingResult result = dispatcher.submitAndWait(request);
        HttpStatus status;
        if (result.isSuccess()) {
            status = HttpStatus.OK;
        } else if (result.failureReason().startsWith(EnhancementDispatcher.CAPACITY)) {
            status = HttpStatus.SERVICE_UNAVAILABLE;
        } else {
            status = HttpStatus.UNPROCESSABLE_ENTITY;
        }
        return ResponseEntity.status(status).body(EnhanceResponse.from(result));
    }

    /**
     * Builds the domain request. The body's requester wins over the {@code X-User-ID} header.
     */
    static EnhancementRequest toRequest(EnhanceRequestBody body, String requesterHeader) {
        Path source;
        try {
            source = Path.of(body.source());
        } catch (InvalidPathException e) {
            throw new InvalidRequestException("source", "not a valid path");
        }
        Operation operation;
        try {
            operation = Operation.parse(body.operation());
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("operation", e.getMessage());
        }

        EnhancementRequest request = switch (operation) {
            case CONVERT_FORMAT -> EnhancementRequest.convert(source, parseFormat(body.format()));
            case CUSTOM_UPSCALE -> customUpscale(source, body);
            default -> EnhancementRequest.of(source, operation);
        };
        String requester = body.requester() == null || body.requester().isBlank()
                ? requesterHeader
                : body.requester();
        return request.withRequester(requester);
    }

    private static EnhancementRequest customUpscale(Path source, EnhanceRequestBody body) {
        UpscaleOption option = UpscaleOption.parse(body.option());
        int factor = body.scaleFactor() != null ? body.scaleFactor() : option.scaleFactor();
        if (!EnhancementRequest.SUPPORTED_SCALE_FACTORS.contains(factor)) {
            throw new InvalidRequestException("scaleFactor", "must be one of 2, 3, 4 or 8, got " + factor);
        }
        UpscaleMode mode = body.mode() != null ? UpscaleMode.parse(body.mode()) : option.mode();
        return EnhancementRequest.customUpscale(source, factor, mode);
    }

    private static ImageFormat parseFormat(String format) {
        try {
            return ImageFormat.parse(format);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("format", e.getMessage());
        }
    }
}
