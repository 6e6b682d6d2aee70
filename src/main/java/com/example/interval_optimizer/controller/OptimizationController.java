package com.example.interval_optimizer.controller;

import com.example.interval_optimizer.dto.OptimizationResult;
import com.example.interval_optimizer.dto.web.IntervalPayload;
import com.example.interval_optimizer.dto.web.OptimizeRequest;
import com.example.interval_optimizer.selector.Interval;
import com.example.interval_optimizer.service.IntervalDataException;
import com.example.interval_optimizer.service.OptimizationService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * REST controller exposing interval optimisation.
 */
@RestController
@RequestMapping("/v1/intervals")
public class OptimizationController {
    private static final Logger log = LoggerFactory.getLogger(OptimizationController.class);

    private final OptimizationService optimizationService;

    public OptimizationController(OptimizationService optimizationService) {
        this.optimizationService = optimizationService;
    }

    /**
     * Selects the best non-overlapping subset of the posted intervals.
     *
     * @param request intervals and optional trade-off.
     * @return selected intervals with score, total cost and count.
     */
    @PostMapping("/optimize")
    public OptimizationResult optimize(@Valid @RequestBody OptimizeRequest request) {
        ensureFinite(request.tradeOff());
        List<Interval> intervals = request.intervals().stream()
                .map(IntervalPayload::toInterval)
                .toList();
        try {
            return optimizationService.optimize(intervals, request.tradeOff());
        } catch (IllegalArgumentException e) {
            throw outOfRange(e);
        }
    }

    /**
     * Same as {@link #optimize(OptimizeRequest)} for an uploaded {@code Interval_start,Interval_end,Cost} CSV.
     *
     * @param file     CSV upload.
     * @param tradeOff optional trade-off.
     * @return selected intervals with score, total cost and count.
     */
    @PostMapping(value = "/optimize/csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public OptimizationResult optimizeCsv(@RequestPart("file") MultipartFile file,
                                          @RequestParam(value = "tradeOff", required = false) Double tradeOff) throws IOException {
        ensureFinite(tradeOff);
        String name = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload";
        try (InputStream in = file.getInputStream()) {
            return optimizationService.optimizeCsv(in, name, tradeOff);
        } catch (IntervalDataException e) {
            log.warn("Rejected interval upload {}: {}", name, e.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "MALFORMED_INTERVALS", e);
        } catch (IllegalArgumentException e) {
            throw outOfRange(e);
        }
    }

    private static ResponseStatusException outOfRange(IllegalArgumentException e) {
        log.warn("Rejected optimization: {}", e.getMessage());
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, "TRADE_OFF_OUT_OF_RANGE", e);
    }

    private static void ensureFinite(Double tradeOff) {
        if (tradeOff != null && (tradeOff.isNaN() || tradeOff.isInfinite())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_TRADE_OFF");
        }
    }
}
