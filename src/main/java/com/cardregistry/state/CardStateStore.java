package com.cardregistry.state;

import com.cardregistry.common.UInt128;
import com.cardregistry.common.exception.CardNotFoundException;
import com.cardregistry.common.exception.MaxUsesReachedException;
import com.cardregistry.common.exception.ZeroUseCountException;
import com.cardregistry.ledger.CardLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;

/**
 * Per-card meta (uses, level) and the numeric rules around it.
 *
 * {@link #recordUse(long, BigInteger)} is the only place uses grow, and the only
 * place the {@code uses <= maxUses} bound is checked. Existence is always answered
 * by the {@link CardLedger}: a card minted but never used still exists.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CardStateStore {

    private final CardMetaRepository metaRepository;
    private final CardLedger cardLedger;
    private final CardLimits cardLimits;

    /**
     * Create the meta record of a freshly minted card with zero uses.
     * The caller guarantees the identifier is new.
     */
    @Transactional
    public void setMeta(long cardId, BigInteger level) {
        metaRepository.save(new CardMeta(cardId, UInt128.require(level, "level")));
        log.debug("Meta created for card {} at level {}", cardId, level);
    }

    /**
     * Drop the meta record of a burned card. No-op if there is none.
     */
    @Transactional
    public void clearMeta(long cardId) {
        metaRepository.findByCardId(cardId).ifPresent(meta -> {
            metaRepository.delete(meta);
            log.debug("Meta cleared for card {}", cardId);
        });
    }

    /**
     * Add {@code count} uses to a card.
     *
     * @return the card's uses after the increment
     * @throws ZeroUseCountException if count is zero
     * @throws MaxUsesReachedException if the result would exceed maxUses; uses stay unchanged
     */
    @Transactional
    public BigInteger recordUse(long cardId, BigInteger count) {
        UInt128.require(count, "count");
        if (count.signum() == 0) {
            throw new ZeroUseCountException();
        }

        CardMeta meta = metaRepository.findByCardId(cardId)
            .orElseThrow(() -> new CardNotFoundException(cardId));
        BigInteger maxUses = cardLimits.getMaxUses();
        if (meta.getUses().add(count).compareTo(maxUses) > 0) {
            throw new MaxUsesReachedException(cardId, meta.getUses(), count, maxUses);
        }

        BigInteger newUses = meta.addUses(count);
        metaRepository.save(meta);
        return newUses;
    }

    /**
     * @return true if {@code count} more uses fit under maxUses for this card
     */
    @Transactional(readOnly = true)
    public boolean canAccept(long cardId, BigInteger count) {
        BigInteger uses = getMeta(cardId).getUses();
        return uses.add(count).compareTo(cardLimits.getMaxUses()) <= 0;
    }

    @Transactional(readOnly = true)
    public CardMetaView getMeta(long cardId) {
        if (!cardLedger.exists(cardId)) {
            throw new CardNotFoundException(cardId);
        }
        return metaRepository.findByCardId(cardId)
            .map(meta -> new CardMetaView(cardId, meta.getUses(), meta.getLevel()))
            .orElseGet(() -> new CardMetaView(cardId, BigInteger.ZERO, BigInteger.ZERO));
    }

    @Transactional(readOnly = true)
    public BigInteger usesOf(long cardId) {
        return getMeta(cardId).getUses();
    }

    @Transactional(readOnly = true)
    public BigInteger levelOf(long cardId) {
        return getMeta(cardId).getLevel();
    }

    /**
     * @return the largest uses value held by any existing card, zero if none
     */
    @Transactional(readOnly = true)
    public BigInteger highestRecordedUses() {
        return metaRepository.findHighestUses().orElse(BigInteger.ZERO);
    }
}
