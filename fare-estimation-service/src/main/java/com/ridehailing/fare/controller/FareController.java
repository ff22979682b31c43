package com.ridehailing.fare.controller;

import com.ridehailing.fare.exception.UnsupportedServiceException;
import com.ridehailing.fare.model.FareComparison;
import com.ridehailing.fare.model.FareComparisonRequest;
import com.ridehailing.fare.model.FareEstimateRequest;
import com.ridehailing.fare.model.SurgeInfo;
import com.ridehailing.fare.pricing.Coordinates;
import com.ridehailing.fare.pricing.PricingResult;
import com.ridehailing.fare.service.FareEstimationService;
import com.ridehailing.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/api/v1/fares")
@RequiredArgsConstructor
public class FareController {

    private final FareEstimationService fareEstimationService;

    /**
     * Itemized estimate for a single service.
     */
    @PostMapping("/estimate")
    public ResponseEntity<ApiResponse<PricingResult>> estimate(@Valid @RequestBody FareEstimateRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(fareEstimationService.estimate(request)));
    }

    /**
     * Side-by-side estimates for all (or the requested) services.
     */
    @PostMapping("/compare")
    public ResponseEntity<ApiResponse<FareComparison>> compare(@Valid @RequestBody FareComparisonRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(fareEstimationService.compare(request)));
    }

    @GetMapping("/surge")
    public ResponseEntity<ApiResponse<SurgeInfo>> surge(
            @RequestParam("pickupLat") double pickupLat,
            @RequestParam("pickupLng") double pickupLng,
            @RequestParam("destinationLat") double destinationLat,
            @RequestParam("destinationLng") double destinationLng,
            @RequestParam(value = "at", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime at) {

        SurgeInfo surge = fareEstimationService.surge(
                Coordinates.of(pickupLat, pickupLng), Coordinates.of(destinationLat, destinationLng), at);
        return ResponseEntity.ok(ApiResponse.ok(surge));
    }

    @GetMapping("/recommendations")
    public ResponseEntity<ApiResponse<List<String>>> recommendations(
            @RequestParam(value = "at", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime at) {

        return ResponseEntity.ok(ApiResponse.ok(fareEstimationService.recommendations(at)));
    }

    @GetMapping("/airport-surcharge")
    public ResponseEntity<ApiResponse<Map<String, Object>>> airportSurcharge(
            @RequestParam("pickupLat") double pickupLat,
            @RequestParam("pickupLng") double pickupLng,
            @RequestParam("destinationLat") double destinationLat,
            @RequestParam("destinationLng") double destinationLng) {

        boolean applies = fareEstimationService.hasAirportSurcharge(
                Coordinates.of(pickupLat, pickupLng), Coordinates.of(destinationLat, destinationLng));
        return ResponseEntity.ok(ApiResponse.ok(Map.of("airportSurcharge", applies)));
    }

    @ExceptionHandler(UnsupportedServiceException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnsupportedService(UnsupportedServiceException ex) {
        log.warn("Fare request rejected [{}]: {}", ex.getCode(), ex.getMessage());
        return ResponseEntity.badRequest().body(ApiResponse.error(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .sorted()
                .collect(Collectors.joining(", ", "Invalid fields: ", ""));
        log.warn("Fare request rejected [VALIDATION_FAILED]: {}", message);
        return ResponseEntity.badRequest().body(ApiResponse.error("VALIDATION_FAILED", message));
    }
}
