package com.vaultledger.partner;

import com.vaultledger.domain.Partner;

/**
 * A partner together with the plaintext API key. The key is never stored and is returned exactly once.
 */
public record IssuedKey(Partner partner, String apiKey) {
}
