package com.cred.freestyle.arbitrage.api.controller;

import com.cred.freestyle.arbitrage.api.dto.CanonicalSizeResponse;
import com.cred.freestyle.arbitrage.api.dto.ConflictResolutionRequest;
import com.cred.freestyle.arbitrage.api.dto.SizeAliasRequest;
import com.cred.freestyle.arbitrage.api.dto.SizeAliasResponse;
import com.cred.freestyle.arbitrage.api.dto.SizeConflictResponse;
import com.cred.freestyle.arbitrage.api.dto.SizeConversionResponse;
import com.cred.freestyle.arbitrage.domain.model.Gender;
import com.cred.freestyle.arbitrage.domain.model.ResolvedSize;
import com.cred.freestyle.arbitrage.domain.model.SizeAlias;
import com.cred.freestyle.arbitrage.domain.model.SizeConflict;
import com.cred.freestyle.arbitrage.domain.model.SizeConflict.ConflictStatus;
import com.cred.freestyle.arbitrage.domain.model.SizeStandard;
import com.cred.freestyle.arbitrage.security.SecurityUtils;
import com.cred.freestyle.arbitrage.service.size.SizeStandardizationService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for the size index: lookup, conversion, brand specific aliases
 * and review of conflicting size mappings.
 *
 * Reads are public. Writes require ADMIN role.
 *
 * @author Arbitrage Team
 */
@RestController
@RequestMapping("/api/v1/sizes")
public class SizeController {

    private static final Logger logger = LoggerFactory.getLogger(SizeController.class);

    private final SizeStandardizationService sizeService;

    public SizeController(SizeStandardizationService sizeService) {
        this.sizeService = sizeService;
    }

    /**
     * Resolve a raw size notation, e.g. {@code /sizes/resolve?standard=EU&value=42&gender=men&brand=nike}.
     */
    @GetMapping("/resolve")
    public ResponseEntity<CanonicalSizeResponse> resolve(
            @RequestParam String standard,
            @RequestParam String value,
            @RequestParam String gender,
            @RequestParam(required = false) String brand,
            @RequestParam(required = false) String category
    ) {
        ResolvedSize resolved = sizeService.resolve(SizeStandard.fromCode(standard), value,
                Gender.fromCode(gender), brand, category);

        CanonicalSizeResponse response = CanonicalSizeResponse.fromEntity(resolved.getCanonicalSize());
        response.setMethod(resolved.getMethod().name());
        response.setSizeAliasId(resolved.getSizeAliasId());
        return ResponseEntity.ok(response);
    }

    @GetMapping
    public ResponseEntity<List<CanonicalSizeResponse>> listSizes(@RequestParam String gender) {
        List<CanonicalSizeResponse> sizes = sizeService.listSizes(Gender.fromCode(gender)).stream()
                .map(CanonicalSizeResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(sizes);
    }

    @GetMapping("/{canonicalSizeId}")
    public ResponseEntity<CanonicalSizeResponse> getSize(@PathVariable String canonicalSizeId) {
        return ResponseEntity.ok(CanonicalSizeResponse.fromEntity(sizeService.getSize(canonicalSizeId)));
    }

    @GetMapping("/{canonicalSizeId}/convert")
    public ResponseEntity<SizeConversionResponse> convert(
            @PathVariable String canonicalSizeId,
            @RequestParam String standard
    ) {
        SizeStandard target = SizeStandard.fromCode(standard);
        BigDecimal value = sizeService.convert(canonicalSizeId, target);
        return ResponseEntity.ok(new SizeConversionResponse(canonicalSizeId, target.name(), value));
    }

    @GetMapping("/aliases")
    public ResponseEntity<List<SizeAliasResponse>> listAliases() {
        return ResponseEntity.ok(sizeService.listAliases().stream()
                .map(SizeAliasResponse::fromEntity)
                .collect(Collectors.toList()));
    }

    @PostMapping("/aliases")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<SizeAliasResponse> createAlias(@Valid @RequestBody SizeAliasRequest request) {
        SizeAlias alias = sizeService.createAlias(
                SizeStandard.fromCode(request.getStandard()),
                request.getValue(),
                Gender.fromCode(request.getGender()),
                request.getBrand(),
                request.getCategory(),
                request.getCanonicalSizeId()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(SizeAliasResponse.fromEntity(alias));
    }

    @DeleteMapping("/aliases/{sizeAliasId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> deleteAlias(@PathVariable String sizeAliasId) {
        sizeService.deleteAlias(sizeAliasId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/conflicts")
    public ResponseEntity<List<SizeConflictResponse>> listConflicts(
            @RequestParam(defaultValue = "PENDING") ConflictStatus status
    ) {
        return ResponseEntity.ok(sizeService.listConflicts(status).stream()
                .map(SizeConflictResponse::fromEntity)
                .collect(Collectors.toList()));
    }

    @PostMapping("/conflicts/{conflictId}/resolve")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<SizeConflictResponse> resolveConflict(
            @PathVariable String conflictId,
            @Valid @RequestBody ConflictResolutionRequest request
    ) {
        String reviewer = SecurityUtils.requireCurrentUserId();
        logger.info("Resolving size conflict {} (accept={}) by {}", conflictId, request.getAccept(), reviewer);
        SizeConflict conflict = sizeService.reconcile(conflictId, request.getAccept(), reviewer);
        return ResponseEntity.ok(SizeConflictResponse.fromEntity(conflict));
    }
}
