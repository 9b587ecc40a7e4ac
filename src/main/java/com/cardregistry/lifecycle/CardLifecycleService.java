package com.cardregistry.lifecycle;

import com.cardregistry.common.SerialTransactionRunner;
import com.cardregistry.common.UInt128;
import com.cardregistry.common.exception.CapabilityDeniedException;
import com.cardregistry.common.exception.CardNotFoundException;
import com.cardregistry.common.exception.InvalidTransferException;
import com.cardregistry.common.exception.MaxUsesReachedException;
import com.cardregistry.common.exception.NotOwnerNorApprovedException;
import com.cardregistry.common.exception.RegistryHaltedException;
import com.cardregistry.common.exception.WrongInputParamsException;
import com.cardregistry.common.exception.ZeroUseCountException;
import com.cardregistry.governance.Capability;
import com.cardregistry.governance.CapabilityChecker;
import com.cardregistry.governance.HaltSwitch;
import com.cardregistry.ledger.CardLedger;
import com.cardregistry.metadata.MetadataResolver;
import com.cardregistry.state.CardLimits;
import com.cardregistry.state.CardMetaView;
import com.cardregistry.state.CardStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Mint, burn, transfer and use operations on cards.
 *
 * Every call goes through the same steps:
 * 1. Halt switch (ownership-changing operations only, before anything else)
 * 2. Capability or ownership check
 * 3. Meta reads and writes in {@link CardStateStore}
 * 4. Ownership changes in {@link CardLedger}
 *
 * Calls are serialized and transactional: a failing call leaves no trace, and a
 * failing item rolls back the whole batch it belongs to.
 *
 * Card identifiers come from {@link CardIdSequence}, starting at 0. The sequence is only
 * advanced once every check of a mint call has passed, and rolls back with the call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CardLifecycleService {

    private final CardLedger cardLedger;
    private final CardStateStore cardStateStore;
    private final CardLimits cardLimits;
    private final CapabilityChecker capabilityChecker;
    private final HaltSwitch haltSwitch;
    private final MetadataResolver metadataResolver;
    private final SerialTransactionRunner runner;
    private final CardIdSequenceRepository idSequenceRepository;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * @return the identifier assigned to the new card
     */
    public long mint(String actorId, String to, BigInteger level) {
        return runner.call(() -> {
            requireNotHalted("mint");
            requireCapability(actorId, Capability.MINTER);
            validateMintTarget(to, level);
            return mintOne(to, level);
        });
    }

    /**
     * Mint {@code tos.size()} cards, the i-th to {@code tos[i]} at {@code levels[i]},
     * with consecutive identifiers in input order.
     *
     * @return the identifiers assigned, in input order
     */
    public List<Long> mintBatch(String actorId, List<String> tos, List<BigInteger> levels) {
        return runner.call(() -> {
            requireNotHalted("mintBatch");
            requireCapability(actorId, Capability.MINTER);
            if (tos == null || levels == null || tos.isEmpty() || tos.size() != levels.size()) {
                throw new WrongInputParamsException(
                    tos == null ? 0 : tos.size(), levels == null ? 0 : levels.size());
            }
            for (int i = 0; i < tos.size(); i++) {
                validateMintTarget(tos.get(i), levels.get(i));
            }

            List<Long> cardIds = new ArrayList<>(tos.size());
            for (int i = 0; i < tos.size(); i++) {
                cardIds.add(mintOne(tos.get(i), levels.get(i)));
            }
            log.info("Batch minted {} cards by {}: {}", cardIds.size(), actorId, cardIds);
            return cardIds;
        });
    }

    public void burn(String actorId, long cardId) {
        runner.run(() -> {
            requireNotHalted("burn");
            burnOne(actorId, cardId);
        });
    }

    /**
     * Burn every card in order. Any failure aborts and rolls back the whole batch.
     */
    public void burnBatch(String actorId, List<Long> cardIds) {
        runner.run(() -> {
            requireNotHalted("burnBatch");
            for (Long cardId : cardIds) {
                burnOne(actorId, cardId);
            }
            log.info("Batch burned {} cards by {}", cardIds.size(), actorId);
        });
    }

    public void transfer(String actorId, String from, String to, long cardId) {
        runner.run(() -> {
            requireNotHalted("transfer");
            transferOne(actorId, from, to, cardId);
        });
    }

    /**
     * Transfer every card in order from one holder to another. Any failure aborts
     * and rolls back the whole batch.
     */
    public void transferBatch(String actorId, String from, String to, List<Long> cardIds) {
        runner.run(() -> {
            requireNotHalted("transferBatch");
            for (Long cardId : cardIds) {
                transferOne(actorId, from, to, cardId);
            }
            log.info("Batch transferred {} cards from {} to {} by {}", cardIds.size(), from, to, actorId);
        });
    }

    /**
     * Record {@code count} uses on one card. Not blocked by the halt switch.
     *
     * @return the card's meta after the use
     */
    public CardMetaView use(String actorId, long cardId, BigInteger count) {
        return runner.call(() -> {
            requireCapability(actorId, Capability.OPERATOR);
            if (!cardLedger.exists(cardId)) {
                throw new CardNotFoundException(cardId);
            }
            requirePositiveCount(count);
            return applyUse(cardId, count);
        });
    }

    /**
     * Record {@code count} uses on the first card of the holder, in enumeration order,
     * that can still take them. Exactly one card is charged.
     *
     * @return the meta of the charged card after the use
     * @throws CardNotFoundException if the holder owns no cards
     * @throws MaxUsesReachedException if none of the holder's cards can take the count
     */
    public CardMetaView useFromHolder(String actorId, String holderId, BigInteger count) {
        return runner.call(() -> {
            requireCapability(actorId, Capability.OPERATOR);
            requirePositiveCount(count);
            if (cardLedger.balanceOf(holderId) == 0) {
                throw CardNotFoundException.forHolder(holderId);
            }

            long cardId = findFirstUsable(holderId, count)
                .orElseThrow(() -> MaxUsesReachedException.forHolder(
                    holderId, count, cardLimits.getMaxUses()));
            return applyUse(cardId, count);
        });
    }

    /**
     * Approve one account to move or burn a card. The actor must be the owner or one of
     * the owner's operators. The approval is cleared when the card changes hands.
     */
    public void approve(String actorId, String spenderId, long cardId) {
        runner.run(() -> cardLedger.approve(actorId, spenderId, cardId));
    }

    public void setApprovalForAll(String ownerId, String operatorId, boolean approved) {
        runner.run(() -> cardLedger.setApprovalForAll(ownerId, operatorId, approved));
    }

    public String getApproved(long cardId) {
        return runner.query(() -> cardLedger.getApproved(cardId));
    }

    public boolean isApprovedForAll(String ownerId, String operatorId) {
        return runner.query(() -> cardLedger.isApprovedForAll(ownerId, operatorId));
    }

    /**
     * Whether {@link #useFromHolder} would succeed for this holder and count right now.
     * Returns false, never throws, for a zero count or a holder without cards.
     */
    public boolean canUseFrom(String holderId, BigInteger count) {
        return runner.query(() -> {
            if (!UInt128.isValid(count) || count.signum() == 0) {
                return false;
            }
            if (cardLedger.balanceOf(holderId) == 0) {
                return false;
            }
            return findFirstUsable(holderId, count).isPresent();
        });
    }

    /**
     * @return the sum of uses across all cards of the holder
     * @throws CardNotFoundException if the holder owns no cards
     */
    public BigInteger totalUsesOf(String holderId) {
        return runner.query(() -> {
            long balance = cardLedger.balanceOf(holderId);
            if (balance == 0) {
                throw CardNotFoundException.forHolder(holderId);
            }
            BigInteger total = BigInteger.ZERO;
            for (long index = 0; index < balance; index++) {
                total = total.add(cardStateStore.usesOf(cardLedger.cardOfOwnerByIndex(holderId, index)));
            }
            return total;
        });
    }

    public BigInteger usesOf(long cardId) {
        return runner.query(() -> cardStateStore.usesOf(cardId));
    }

    public BigInteger levelOf(long cardId) {
        return runner.query(() -> cardStateStore.levelOf(cardId));
    }

    public CardMetaView getMeta(long cardId) {
        return runner.query(() -> cardStateStore.getMeta(cardId));
    }

    public String cardUri(long cardId) {
        return runner.query(() -> metadataResolver.cardUri(cardId));
    }

    public String ownerOf(long cardId) {
        return runner.query(() -> cardLedger.ownerOf(cardId));
    }

    public long balanceOf(String holderId) {
        return runner.query(() -> cardLedger.balanceOf(holderId));
    }

    public long cardOfOwnerByIndex(String holderId, long index) {
        return runner.query(() -> cardLedger.cardOfOwnerByIndex(holderId, index));
    }

    public boolean exists(long cardId) {
        return runner.query(() -> cardLedger.exists(cardId));
    }

    public long totalSupply() {
        return runner.query(cardLedger::totalSupply);
    }

    /**
     * @return the identifier the next minted card will receive
     */
    public long nextCardId() {
        return runner.query(() -> idSequenceRepository.findById(CardIdSequence.ROW_ID)
            .map(CardIdSequence::getNextValue)
            .orElse(0L));
    }

    public BigInteger maxUses() {
        return cardLimits.getMaxUses();
    }

    public BigInteger maxOwns() {
        return cardLimits.getMaxOwns();
    }

    private long mintOne(String to, BigInteger level) {
        CardIdSequence sequence = idSequenceRepository.findById(CardIdSequence.ROW_ID)
            .orElseGet(() -> new CardIdSequence(0));
        long cardId = sequence.getAndIncrement();
        idSequenceRepository.save(sequence);
        cardLedger.mintOwnership(to, cardId);
        cardStateStore.setMeta(cardId, level);
        log.info("Minted card {} to {} at level {}", cardId, to, level);
        return cardId;
    }

    private void burnOne(String actorId, long cardId) {
        if (!cardLedger.isApprovedOrOwner(actorId, cardId)) {
            throw new NotOwnerNorApprovedException(actorId, cardId);
        }
        cardLedger.burnOwnership(cardId);
        cardStateStore.clearMeta(cardId);
        log.info("Burned card {} by {}", cardId, actorId);
    }

    private void transferOne(String actorId, String from, String to, long cardId) {
        if (!cardLedger.isApprovedOrOwner(actorId, cardId)) {
            throw new NotOwnerNorApprovedException(actorId, cardId);
        }
        cardLedger.transferOwnership(from, to, cardId);
        log.info("Transferred card {} from {} to {} by {}", cardId, from, to, actorId);
    }

    private CardMetaView applyUse(long cardId, BigInteger count) {
        BigInteger newUses = cardStateStore.recordUse(cardId, count);
        BigInteger remaining = cardLimits.getMaxUses().subtract(newUses);
        log.info("Recorded {} uses on card {}, {} remaining", count, cardId, remaining);
        eventPublisher.publishEvent(new CardUsedEvent(cardId, remaining));
        return cardStateStore.getMeta(cardId);
    }

    /**
     * First-fit scan over the holder's cards in enumeration order.
     */
    private Optional<Long> findFirstUsable(String holderId, BigInteger count) {
        long balance = cardLedger.balanceOf(holderId);
        for (long index = 0; index < balance; index++) {
            long cardId = cardLedger.cardOfOwnerByIndex(holderId, index);
            if (cardStateStore.canAccept(cardId, count)) {
                log.debug("Holder {} index {} (card {}) can take {} uses", holderId, index, cardId, count);
                return Optional.of(cardId);
            }
        }
        log.debug("None of {} cards of holder {} can take {} uses", balance, holderId, count);
        return Optional.empty();
    }

    private void validateMintTarget(String to, BigInteger level) {
        if (to == null || to.isBlank()) {
            throw new InvalidTransferException("Invalid transfer: mint to an empty holder");
        }
        UInt128.require(level, "level");
    }

    private static void requirePositiveCount(BigInteger count) {
        UInt128.require(count, "count");
        if (count.signum() == 0) {
            throw new ZeroUseCountException();
        }
    }

    private void requireCapability(String actorId, Capability capability) {
        if (!capabilityChecker.hasCapability(actorId, capability)) {
            throw new CapabilityDeniedException(actorId, capability.name());
        }
    }

    private void requireNotHalted(String operation) {
        if (haltSwitch.isHalted()) {
            throw new RegistryHaltedException(operation);
        }
    }
}
