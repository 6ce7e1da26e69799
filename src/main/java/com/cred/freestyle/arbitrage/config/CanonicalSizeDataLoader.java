package com.cred.freestyle.arbitrage.config;

import com.cred.freestyle.arbitrage.service.size.SizeStandardizationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Seeds the default canonical size table on startup when it is empty.
 *
 * @author Arbitrage Team
 */
@Component
@ConditionalOnProperty(name = "arbitrage.sizes.seed.enabled", havingValue = "true", matchIfMissing = true)
public class CanonicalSizeDataLoader implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(CanonicalSizeDataLoader.class);

    private final SizeStandardizationService sizeService;

    public CanonicalSizeDataLoader(SizeStandardizationService sizeService) {
        this.sizeService = sizeService;
    }

    @Override
    public void run(String... args) {
        int created = sizeService.seedDefaultSizes();
        if (created == 0) {
            logger.info("Canonical size table already populated, skipping seed");
        }
    }
}
