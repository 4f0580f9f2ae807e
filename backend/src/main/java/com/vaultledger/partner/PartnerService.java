package com.vaultledger.partner;

import com.vaultledger.common.Addresses;
import com.vaultledger.common.KeyedLocks;
import com.vaultledger.common.NotFoundException;
import com.vaultledger.common.ValidationException;
import com.vaultledger.config.CaffeineConfig;
import com.vaultledger.domain.Partner;
import com.vaultledger.domain.PartnerLoanRepository;
import com.vaultledger.domain.PartnerLoanStatus;
import com.vaultledger.domain.PartnerRepository;
import com.vaultledger.domain.PartnerStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Partner registry: onboarding, API key issue and rotation, status, limits and lifetime stats.
 * Only the sha256 of a key is persisted. Stat updates are serialized per partner.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PartnerService {

    public static final String PARTNER_NOT_FOUND = "PARTNER_NOT_FOUND";

    private static final Pattern PREFIX = Pattern.compile("^[a-z0-9]{2,16}$");
    private static final int KEY_PREFIX_LENGTH = 16;
    private static final HexFormat HEX = HexFormat.of();

    private final PartnerRepository partnerRepository;
    private final PartnerLoanRepository partnerLoanRepository;
    private final PartnerProperties partnerProperties;
    private final SecureRandom random = new SecureRandom();
    private final KeyedLocks<String> locks = new KeyedLocks<>();

    public IssuedKey createPartner(NewPartner request) {
        if (request.name() == null || request.name().isBlank()) {
            throw new ValidationException("name is required");
        }
        if (request.prefix() == null || !PREFIX.matcher(request.prefix()).matches()) {
            throw new ValidationException("prefix must be 2-16 lowercase letters or digits");
        }
        requireLimit("dailyBorrowLimit", request.dailyBorrowLimit());
        requireLimit("totalBorrowLimit", request.totalBorrowLimit());
        int feeBps = request.platformFeeBps() != null ? request.platformFeeBps() : partnerProperties.getDefaultPlatformFeeBps();
        if (feeBps < 0 || feeBps > 10_000) {
            throw new ValidationException("platformFeeBps must be between 0 and 10000");
        }

        String apiKey = generateApiKey(request.prefix());
        Instant now = Instant.now();
        Partner partner = new Partner();
        partner.setPartnerId("partner_" + request.prefix() + "_" + HEX.formatHex(randomBytes(4)));
        partner.setName(request.name().trim());
        partner.setApiKeyHash(hashApiKey(apiKey));
        partner.setApiKeyPrefix(apiKey.substring(0, KEY_PREFIX_LENGTH));
        partner.setStatus(PartnerStatus.ACTIVE);
        partner.setTier(request.tier() != null ? request.tier() : "standard");
        partner.setDailyBorrowLimit(request.dailyBorrowLimit());
        partner.setTotalBorrowLimit(request.totalBorrowLimit());
        partner.setPlatformFeeBps(feeBps);
        partner.setSettlementAddress(Addresses.normalize("settlementAddress", request.settlementAddress()));
        partner.setCreatedAt(now);
        partner.setLastActivityAt(now);
        Partner saved = partnerRepository.insert(partner);
        log.info("Partner {} created (tier {}, fee {} bps)", saved.getPartnerId(), saved.getTier(), feeBps);
        return new IssuedKey(saved, apiKey);
    }

    @CacheEvict(cacheNames = CaffeineConfig.PARTNER_BY_KEY_HASH_CACHE, allEntries = true)
    public IssuedKey regenerateKey(String partnerId) {
        return locks.withLock(partnerId, () -> {
            Partner partner = getPartner(partnerId);
            String prefix = partnerId.split("_")[1];
            String apiKey = generateApiKey(prefix);
            partner.setApiKeyHash(hashApiKey(apiKey));
            partner.setApiKeyPrefix(apiKey.substring(0, KEY_PREFIX_LENGTH));
            Partner saved = partnerRepository.save(partner);
            log.info("API key regenerated for partner {}", partnerId);
            return new IssuedKey(saved, apiKey);
        });
    }

    @CacheEvict(cacheNames = CaffeineConfig.PARTNER_BY_KEY_HASH_CACHE, allEntries = true)
    public Partner updateStatus(String partnerId, PartnerStatus status) {
        if (status == null) {
            throw new ValidationException("status is required");
        }
        Partner saved = update(partnerId, p -> p.setStatus(status));
        log.info("Partner {} status set to {}", partnerId, status);
        return saved;
    }

    @CacheEvict(cacheNames = CaffeineConfig.PARTNER_BY_KEY_HASH_CACHE, allEntries = true)
    public Partner updateLimits(String partnerId, BigInteger dailyBorrowLimit, BigInteger totalBorrowLimit) {
        if (dailyBorrowLimit != null) {
            requireLimit("dailyBorrowLimit", dailyBorrowLimit);
        }
        if (totalBorrowLimit != null) {
            requireLimit("totalBorrowLimit", totalBorrowLimit);
        }
        return update(partnerId, p -> {
            if (dailyBorrowLimit != null) {
                p.setDailyBorrowLimit(dailyBorrowLimit);
            }
            if (totalBorrowLimit != null) {
                p.setTotalBorrowLimit(totalBorrowLimit);
            }
        });
    }

    /**
     * Cached by key hash. The cached copy is for authentication only; mutations reload by id.
     */
    @Cacheable(cacheNames = CaffeineConfig.PARTNER_BY_KEY_HASH_CACHE, key = "#apiKeyHash", unless = "#result == null")
    public Partner findByKeyHash(String apiKeyHash) {
        return partnerRepository.findByApiKeyHash(apiKeyHash).orElse(null);
    }

    public Partner getPartner(String partnerId) {
        return partnerRepository.findById(partnerId)
                .orElseThrow(() -> new NotFoundException(PARTNER_NOT_FOUND, "Partner not found: " + partnerId));
    }

    public List<Partner> listPartners() {
        return partnerRepository.findAll();
    }

    public PartnerStats stats(String partnerId) {
        Partner p = getPartner(partnerId);
        long activeLoans = partnerLoanRepository.findByPartnerIdOrderByCreatedAtDesc(partnerId).stream()
                .filter(l -> l.getStatus() == PartnerLoanStatus.ACTIVE)
                .count();
        return new PartnerStats(p.getPartnerId(), p.getName(), p.getTier(), p.getStatus(),
                p.getDailyBorrowLimit(), p.getTotalBorrowLimit(), p.getCurrentOutstanding(),
                p.getTotalBorrowed(), p.getTotalRepaid(), activeLoans);
    }

    public Partner recordBorrow(String partnerId, BigInteger amount) {
        return update(partnerId, p -> {
            p.setCurrentOutstanding(p.getCurrentOutstanding().add(amount));
            p.setTotalBorrowed(p.getTotalBorrowed().add(amount));
        });
    }

    /**
     * Outstanding never goes below zero: repayments may include interest on top of the borrowed principal.
     */
    public Partner recordRepayment(String partnerId, BigInteger amount) {
        return update(partnerId, p -> {
            p.setCurrentOutstanding(p.getCurrentOutstanding().subtract(amount).max(BigInteger.ZERO));
            p.setTotalRepaid(p.getTotalRepaid().add(amount));
        });
    }

    String generateApiKey(String prefix) {
        return "pk_" + prefix + "_" + partnerProperties.getKeyEnvironment() + "_" + HEX.formatHex(randomBytes(16));
    }

    static String hashApiKey(String apiKey) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HEX.formatHex(digest.digest(apiKey.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private Partner update(String partnerId, Consumer<Partner> change) {
        return locks.withLock(partnerId, () -> {
            Partner partner = getPartner(partnerId);
            change.accept(partner);
            partner.setLastActivityAt(Instant.now());
            return partnerRepository.save(partner);
        });
    }

    private byte[] randomBytes(int n) {
        byte[] bytes = new byte[n];
        random.nextBytes(bytes);
        return bytes;
    }

    private static void requireLimit(String field, BigInteger value) {
        if (value == null || value.signum() <= 0) {
            throw new ValidationException(ValidationException.INVALID_AMOUNT, field + " must be greater than zero");
        }
    }
}
