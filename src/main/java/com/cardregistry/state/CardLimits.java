package com.cardregistry.state;

import com.cardregistry.common.UInt128;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Global limits read by the use and mint paths.
 *
 * {@code maxOwns} is kept and reported but not enforced anywhere: no mint or transfer
 * checks a holder's balance against it.
 */
@Component
@Slf4j
public class CardLimits {

    private volatile BigInteger maxOwns;
    private volatile BigInteger maxUses;

    public CardLimits(@Value("${card-registry.limits.max-owns:10}") BigInteger maxOwns,
                      @Value("${card-registry.limits.max-uses:10}") BigInteger maxUses) {
        this.maxOwns = UInt128.require(maxOwns, "maxOwns");
        this.maxUses = UInt128.require(maxUses, "maxUses");
        log.info("Card limits initialized: maxOwns={}, maxUses={}", maxOwns, maxUses);
    }

    public BigInteger getMaxOwns() {
        return maxOwns;
    }

    public BigInteger getMaxUses() {
        return maxUses;
    }

    public void setMaxOwns(BigInteger maxOwns) {
        this.maxOwns = UInt128.require(maxOwns, "maxOwns");
    }

    public void setMaxUses(BigInteger maxUses) {
        this.maxUses = UInt128.require(maxUses, "maxUses");
    }
}
