package com.cred.freestyle.arbitrage.service.size;

import com.cred.freestyle.arbitrage.domain.model.CanonicalSize;
import com.cred.freestyle.arbitrage.domain.model.Gender;
import com.cred.freestyle.arbitrage.domain.model.ResolvedSize;
import com.cred.freestyle.arbitrage.domain.model.SizeAlias;
import com.cred.freestyle.arbitrage.domain.model.SizeConflict;
import com.cred.freestyle.arbitrage.domain.model.SizeConflict.ConflictStatus;
import com.cred.freestyle.arbitrage.domain.model.SizeStandard;
import com.cred.freestyle.arbitrage.domain.model.ValidationOutcome;
import com.cred.freestyle.arbitrage.exception.ResourceNotFoundException;
import com.cred.freestyle.arbitrage.exception.SizeConflictException;
import com.cred.freestyle.arbitrage.exception.SizeNotFoundException;
import com.cred.freestyle.arbitrage.infrastructure.metrics.ArbitrageMetricsService;
import com.cred.freestyle.arbitrage.repository.CanonicalSizeRepository;
import com.cred.freestyle.arbitrage.repository.OfferRepository;
import com.cred.freestyle.arbitrage.repository.SizeAliasRepository;
import com.cred.freestyle.arbitrage.repository.SizeConflictRepository;
import com.cred.freestyle.arbitrage.service.size.SizeValueParser.ParsedSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Size standardization index: maps any regional or brand-specific size notation onto
 * one canonical size, converts back, and audits mappings observed from sources.
 *
 * Resolution order for resolve():
 * 1. Alias matching brand and category
 * 2. Alias matching brand, no category
 * 3. Alias matching category, no brand
 * 4. Stored value of a canonical size in that notation, then the default formula
 *    (see SizeConversions), rounded to the nearest half size
 *
 * A notation that lands outside the seeded range is reported as not found; the index
 * never substitutes a neighbouring size.
 *
 * @author Arbitrage Team
 */
@Service
public class SizeStandardizationService {

    private static final Logger logger = LoggerFactory.getLogger(SizeStandardizationService.class);

    static final BigDecimal VALIDATION_TOLERANCE = new BigDecimal("0.5");

    private final CanonicalSizeRepository canonicalSizeRepository;
    private final SizeAliasRepository sizeAliasRepository;
    private final SizeConflictRepository sizeConflictRepository;
    private final OfferRepository offerRepository;
    private final ArbitrageMetricsService metricsService;
    private final Clock clock;

    public SizeStandardizationService(
            CanonicalSizeRepository canonicalSizeRepository,
            SizeAliasRepository sizeAliasRepository,
            SizeConflictRepository sizeConflictRepository,
            OfferRepository offerRepository,
            ArbitrageMetricsService metricsService,
            Clock clock
    ) {
        this.canonicalSizeRepository = canonicalSizeRepository;
        this.sizeAliasRepository = sizeAliasRepository;
        this.sizeConflictRepository = sizeConflictRepository;
        this.offerRepository = offerRepository;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Resolve a raw size notation to its canonical size.
     *
     * @param standard Notation the value is published in
     * @param rawValue Size string ("9.5", "EU 42 2/3", "9M", ...)
     * @param gender Sizing gender
     * @param brand Brand of the product, optional
     * @param category Product category, optional
     * @return Resolved size and the alias used, if any
     * @throws SizeNotFoundException if no seeded canonical size matches
     * @throws IllegalArgumentException if the value cannot be parsed or contradicts the notation
     */
    @Transactional(readOnly = true)
    public ResolvedSize resolve(SizeStandard standard, String rawValue, Gender gender, String brand, String category) {
        if (standard == null || gender == null) {
            throw new IllegalArgumentException("Size standard and gender are required");
        }
        ParsedSize parsed = SizeValueParser.parse(rawValue);
        if (parsed.getPrefix() != null && parsed.getPrefix() != standard) {
            throw new IllegalArgumentException(String.format(
                    "Size value %s is not in %s notation", rawValue, standard));
        }
        if (parsed.getGenderSuffix() != null && parsed.getGenderSuffix() != gender) {
            throw new IllegalArgumentException(String.format(
                    "Size value %s is not a %s size", rawValue, gender));
        }

        BigDecimal value = parsed.getValue();
        String brandKey = normalizeScope(brand);
        String categoryKey = normalizeScope(category);

        Optional<ResolvedSize> viaAlias = resolveAlias(standard, value, gender, brandKey, categoryKey);
        if (viaAlias.isPresent()) {
            logger.debug("Resolved {} {} ({}) via {}", standard, rawValue, gender, viaAlias.get().getMethod());
            return viaAlias.get();
        }

        List<CanonicalSize> table = canonicalSizeRepository.findByGenderOrderByOrdinalAsc(gender);
        for (CanonicalSize size : table) {
            BigDecimal stored = size.valueIn(standard);
            if (stored != null && stored.compareTo(value) == 0) {
                return new ResolvedSize(size, null, ResolvedSize.Method.DEFAULT_CONVERSION);
            }
        }

        int ordinal = SizeConversions.toOrdinal(SizeConversions.toUs(standard, value, gender));
        return table.stream()
                .filter(size -> size.getOrdinal() == ordinal)
                .findFirst()
                .map(size -> new ResolvedSize(size, null, ResolvedSize.Method.DEFAULT_CONVERSION))
                .orElseThrow(() -> new SizeNotFoundException(standard.name(), rawValue, gender.name()));
    }

    private Optional<ResolvedSize> resolveAlias(SizeStandard standard, BigDecimal value, Gender gender,
                                                String brand, String category) {
        if (brand == null && category == null) {
            return Optional.empty();
        }
        List<SizeAlias> candidates = sizeAliasRepository.findByFromStandardAndFromValueAndGender(standard, value, gender);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        SizeAlias brandAndCategory = null;
        SizeAlias brandOnly = null;
        SizeAlias categoryOnly = null;
        for (SizeAlias alias : candidates) {
            boolean brandMatches = brand != null && brand.equals(alias.getBrand());
            boolean categoryMatches = category != null && category.equals(alias.getCategory());
            if (brandMatches && categoryMatches) {
                brandAndCategory = alias;
            } else if (brandMatches && alias.getCategory() == null) {
                brandOnly = alias;
            } else if (categoryMatches && alias.getBrand() == null) {
                categoryOnly = alias;
            }
        }

        if (brandAndCategory != null) {
            return Optional.of(toResolved(brandAndCategory, ResolvedSize.Method.ALIAS_BRAND_CATEGORY));
        }
        if (categoryOnly != null) {
            return Optional.of(toResolved(categoryOnly, ResolvedSize.Method.ALIAS_CATEGORY));
        }
        if (brandOnly != null) {
            return Optional.of(toResolved(brandOnly, ResolvedSize.Method.ALIAS_BRAND));
        }
        return Optional.empty();
    }

    private ResolvedSize toResolved(SizeAlias alias, ResolvedSize.Method method) {
        CanonicalSize size = canonicalSizeRepository.findById(alias.getCanonicalSizeId())
                .orElseThrow(() -> new IllegalStateException(
                        "Size alias " + alias.getSizeAliasId() + " points to a missing canonical size"));
        return new ResolvedSize(size, alias, method);
    }

    /**
     * Value of a canonical size in another notation.
     *
     * @throws ResourceNotFoundException if the canonical size does not exist
     * @throws SizeNotFoundException if the size has no value in that notation
     */
    @Transactional(readOnly = true)
    public BigDecimal convert(String canonicalSizeId, SizeStandard standard) {
        CanonicalSize size = getSize(canonicalSizeId);
        BigDecimal value = size.valueIn(standard);
        if (value == null) {
            throw new SizeNotFoundException(standard.name(), size.label(), size.getGender().name());
        }
        return value;
    }

    @Transactional(readOnly = true)
    public CanonicalSize getSize(String canonicalSizeId) {
        return canonicalSizeRepository.findById(canonicalSizeId)
                .orElseThrow(() -> new ResourceNotFoundException("CanonicalSize", canonicalSizeId));
    }

    @Transactional(readOnly = true)
    public List<CanonicalSize> listSizes(Gender gender) {
        return canonicalSizeRepository.findByGenderOrderByOrdinalAsc(gender);
    }

    /**
     * Check a mapping observed from a source against the stored value.
     * The canonical size is never changed here; disagreements are queued as PENDING
     * conflicts for {@link #reconcile}.
     *
     * @param canonicalSizeId Canonical size the observation was resolved to
     * @param standard Notation of the observed value
     * @param observedValue Value the source publishes for that size
     * @param source Source name
     * @return CONFIRMED, CONFLICT or UNVERIFIED
     */
    @Transactional
    public ValidationOutcome validate(String canonicalSizeId, SizeStandard standard,
                                      BigDecimal observedValue, String source) {
        CanonicalSize size = getSize(canonicalSizeId);
        BigDecimal stored = size.valueIn(standard);

        if (stored != null && stored.subtract(observedValue).abs().compareTo(VALIDATION_TOLERANCE) <= 0) {
            return ValidationOutcome.CONFIRMED;
        }

        ValidationOutcome outcome = stored == null ? ValidationOutcome.UNVERIFIED : ValidationOutcome.CONFLICT;
        BigDecimal observed = observedValue.setScale(1, RoundingMode.HALF_UP);

        boolean alreadyQueued = sizeConflictRepository
                .existsByCanonicalSizeIdAndStandardAndObservedValueAndObservedSourceAndStatus(
                        canonicalSizeId, standard, observed, source, ConflictStatus.PENDING);
        if (!alreadyQueued) {
            sizeConflictRepository.save(SizeConflict.builder()
                    .canonicalSizeId(canonicalSizeId)
                    .standard(standard)
                    .storedValue(stored)
                    .observedValue(observed)
                    .observedSource(source)
                    .status(ConflictStatus.PENDING)
                    .detectedAt(clock.instant())
                    .build());
            logger.warn("Size mapping {} for {} {}={} from {} queued for review (stored: {})",
                    outcome, size.label(), standard, observed, source, stored);
        }

        metricsService.recordSizeValidation(outcome.name());
        return outcome;
    }

    /**
     * Close a pending conflict. Accepting writes the observed value into the canonical size,
     * provided the notation is not US and the value keeps the notation strictly increasing
     * across neighbouring sizes.
     *
     * @param conflictId Conflict ID
     * @param accept true to apply the observed value, false to dismiss it
     * @param reviewer Who decided
     * @return The closed conflict
     * @throws SizeConflictException if the value cannot be applied
     * @throws IllegalStateException if the conflict is already closed
     */
    @Transactional
    public SizeConflict reconcile(String conflictId, boolean accept, String reviewer) {
        SizeConflict conflict = sizeConflictRepository.findById(conflictId)
                .orElseThrow(() -> new ResourceNotFoundException("SizeConflict", conflictId));
        if (!conflict.isPending()) {
            throw new IllegalStateException("Size conflict " + conflictId + " is already " + conflict.getStatus());
        }

        Instant now = clock.instant();
        if (!accept) {
            conflict.resolve(ConflictStatus.REJECTED, reviewer, now);
            logger.info("Size conflict {} rejected by {}", conflictId, reviewer);
            return sizeConflictRepository.save(conflict);
        }

        SizeStandard standard = conflict.getStandard();
        if (standard == SizeStandard.US) {
            throw new SizeConflictException(conflict.getCanonicalSizeId(),
                    "US sizes anchor the canonical ordinal and cannot be reconciled");
        }

        CanonicalSize size = canonicalSizeRepository.findByIdForUpdate(conflict.getCanonicalSizeId())
                .orElseThrow(() -> new ResourceNotFoundException("CanonicalSize", conflict.getCanonicalSizeId()));
        BigDecimal value = conflict.getObservedValue();

        Optional<CanonicalSize> smaller = canonicalSizeRepository
                .findFirstByGenderAndOrdinalLessThanOrderByOrdinalDesc(size.getGender(), size.getOrdinal());
        Optional<CanonicalSize> larger = canonicalSizeRepository
                .findFirstByGenderAndOrdinalGreaterThanOrderByOrdinalAsc(size.getGender(), size.getOrdinal());

        BigDecimal lower = smaller.map(s -> s.valueIn(standard)).orElse(null);
        BigDecimal upper = larger.map(s -> s.valueIn(standard)).orElse(null);
        if ((lower != null && value.compareTo(lower) <= 0) || (upper != null && value.compareTo(upper) >= 0)) {
            throw new SizeConflictException(size.getCanonicalSizeId(), String.format(
                    "%s %s is not between neighbouring sizes (%s, %s)", standard, value, lower, upper));
        }

        size.applyValue(standard, value);
        size.setValidationSource("reconciliation:" + reviewer);
        size.setLastValidatedAt(now);
        canonicalSizeRepository.save(size);

        conflict.resolve(ConflictStatus.ACCEPTED, reviewer, now);
        logger.info("Size conflict {} accepted by {}: {} {} set to {}",
                conflictId, reviewer, size.label(), standard, value);
        return sizeConflictRepository.save(conflict);
    }

    @Transactional(readOnly = true)
    public List<SizeConflict> listConflicts(ConflictStatus status) {
        return sizeConflictRepository.findByStatusOrderByDetectedAtAsc(status);
    }

    /**
     * Create a brand and/or category scoped alias.
     *
     * @throws IllegalArgumentException if neither brand nor category is given, or genders differ
     * @throws IllegalStateException if an alias with the same scope already exists
     */
    @Transactional
    public SizeAlias createAlias(SizeStandard standard, String rawValue, Gender gender,
                                 String brand, String category, String canonicalSizeId) {
        String brandKey = normalizeScope(brand);
        String categoryKey = normalizeScope(category);
        if (brandKey == null && categoryKey == null) {
            throw new IllegalArgumentException("A size alias needs a brand or a category");
        }

        CanonicalSize target = getSize(canonicalSizeId);
        if (target.getGender() != gender) {
            throw new IllegalArgumentException(String.format(
                    "Alias gender %s does not match canonical size gender %s", gender, target.getGender()));
        }

        BigDecimal value = SizeValueParser.parse(rawValue).getValue();
        boolean duplicate = sizeAliasRepository.findByFromStandardAndFromValueAndGender(standard, value, gender)
                .stream()
                .anyMatch(a -> equalsNullable(a.getBrand(), brandKey) && equalsNullable(a.getCategory(), categoryKey));
        if (duplicate) {
            throw new IllegalStateException(String.format(
                    "Alias for %s %s (%s) already exists for brand=%s category=%s",
                    standard, value, gender, brandKey, categoryKey));
        }

        SizeAlias alias = sizeAliasRepository.save(SizeAlias.builder()
                .fromStandard(standard)
                .fromValue(value)
                .gender(gender)
                .brand(brandKey)
                .category(categoryKey)
                .canonicalSizeId(canonicalSizeId)
                .createdAt(clock.instant())
                .build());
        logger.info("Created size alias {}: {} {} ({}) brand={} category={} -> {}",
                alias.getSizeAliasId(), standard, value, gender, brandKey, categoryKey, target.label());
        return alias;
    }

    /**
     * Delete an alias that no offer was resolved through.
     *
     * @throws IllegalStateException if an offer references the alias
     */
    @Transactional
    public void deleteAlias(String sizeAliasId) {
        SizeAlias alias = sizeAliasRepository.findById(sizeAliasId)
                .orElseThrow(() -> new ResourceNotFoundException("SizeAlias", sizeAliasId));
        if (offerRepository.existsBySizeAliasId(sizeAliasId)) {
            throw new IllegalStateException("Size alias " + sizeAliasId + " is referenced by offers");
        }
        sizeAliasRepository.delete(alias);
        logger.info("Deleted size alias {}", sizeAliasId);
    }

    @Transactional(readOnly = true)
    public List<SizeAlias> listAliases() {
        return sizeAliasRepository.findAllByOrderByCreatedAtAsc();
    }

    /**
     * Seed the default size table from the conversion formula when it is empty.
     *
     * @return Number of sizes created
     */
    @Transactional
    public int seedDefaultSizes() {
        if (canonicalSizeRepository.count() > 0) {
            return 0;
        }
        List<CanonicalSize> sizes = new ArrayList<>();
        addRange(sizes, Gender.MEN, 7, 32);
        addRange(sizes, Gender.WOMEN, 8, 26);
        addRange(sizes, Gender.YOUTH, 7, 14);

        Instant now = clock.instant();
        sizes.forEach(size -> size.setLastValidatedAt(now));
        canonicalSizeRepository.saveAll(sizes);
        logger.info("Seeded {} canonical sizes", sizes.size());
        return sizes.size();
    }

    private static void addRange(List<CanonicalSize> sizes, Gender gender, int fromOrdinal, int toOrdinal) {
        for (int ordinal = fromOrdinal; ordinal <= toOrdinal; ordinal++) {
            sizes.add(SizeConversions.defaultSize(gender, ordinal));
        }
    }

    private static String normalizeScope(String value) {
        return value == null || value.isBlank() ? null : value.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean equalsNullable(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }
}
