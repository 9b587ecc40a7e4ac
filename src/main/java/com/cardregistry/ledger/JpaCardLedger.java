package com.cardregistry.ledger;

import com.cardregistry.common.exception.CardNotFoundException;
import com.cardregistry.common.exception.InvalidTransferException;
import com.cardregistry.common.exception.NotOwnerNorApprovedException;
import com.cardregistry.common.exception.RegistryHaltedException;
import com.cardregistry.governance.HaltSwitch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Card ledger stored in JPA tables.
 *
 * Ownership rows carry their enumeration index directly, so lookups by
 * {@code (owner, index)} are a single indexed read.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaCardLedger implements CardLedger {

    private final CardOwnershipRepository ownershipRepository;
    private final OperatorApprovalRepository operatorApprovalRepository;
    private final HaltSwitch haltSwitch;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Transactional
    public void mintOwnership(String to, long cardId) {
        requireNotHalted("mint");
        requireHolder(to, "mint to an empty holder");
        if (ownershipRepository.existsById(cardId)) {
            throw new InvalidTransferException("Card already minted: " + cardId);
        }

        long index = ownershipRepository.countByOwnerId(to);
        ownershipRepository.save(new CardOwnership(cardId, to, index));

        log.debug("Card {} registered to {} at index {}", cardId, to, index);
        eventPublisher.publishEvent(new CardTransferredEvent(null, to, cardId));
    }

    @Override
    @Transactional
    public void burnOwnership(long cardId) {
        requireNotHalted("burn");
        CardOwnership ownership = getOwnership(cardId);

        removeFromOwnerEnumeration(ownership);
        ownershipRepository.delete(ownership);

        log.debug("Card {} removed from {}", cardId, ownership.getOwnerId());
        eventPublisher.publishEvent(new CardTransferredEvent(ownership.getOwnerId(), null, cardId));
    }

    @Override
    @Transactional
    public void transferOwnership(String from, String to, long cardId) {
        requireNotHalted("transfer");
        requireHolder(to, "transfer to an empty holder");
        CardOwnership ownership = getOwnership(cardId);
        if (!ownership.getOwnerId().equals(from)) {
            throw new InvalidTransferException(String.format(
                "Card %d is not owned by %s", cardId, from));
        }

        if (from.equals(to)) {
            ownership.moveTo(to, ownership.getOwnerIndex());
        } else {
            removeFromOwnerEnumeration(ownership);
            ownership.moveTo(to, ownershipRepository.countByOwnerId(to));
        }
        ownershipRepository.save(ownership);

        log.debug("Card {} moved from {} to {} at index {}", cardId, from, to, ownership.getOwnerIndex());
        eventPublisher.publishEvent(new CardTransferredEvent(from, to, cardId));
    }

    @Override
    @Transactional(readOnly = true)
    public String ownerOf(long cardId) {
        return getOwnership(cardId).getOwnerId();
    }

    @Override
    @Transactional(readOnly = true)
    public long balanceOf(String holderId) {
        if (holderId == null) {
            return 0;
        }
        return ownershipRepository.countByOwnerId(holderId);
    }

    @Override
    @Transactional(readOnly = true)
    public long cardOfOwnerByIndex(String holderId, long index) {
        return ownershipRepository.findByOwnerIdAndOwnerIndex(holderId, index)
            .map(CardOwnership::getCardId)
            .orElseThrow(() -> CardNotFoundException.forHolderIndex(holderId, index));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(long cardId) {
        return ownershipRepository.existsById(cardId);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isApprovedOrOwner(String actorId, long cardId) {
        CardOwnership ownership = getOwnership(cardId);
        if (actorId == null) {
            return false;
        }
        return actorId.equals(ownership.getOwnerId())
            || actorId.equals(ownership.getApprovedId())
            || isApprovedForAll(ownership.getOwnerId(), actorId);
    }

    @Override
    @Transactional(readOnly = true)
    public long totalSupply() {
        return ownershipRepository.count();
    }

    @Override
    @Transactional
    public void approve(String actorId, String spenderId, long cardId) {
        CardOwnership ownership = getOwnership(cardId);
        String ownerId = ownership.getOwnerId();
        if (ownerId.equals(spenderId)) {
            throw new InvalidTransferException("Approval to current owner of card " + cardId);
        }
        if (!ownerId.equals(actorId) && !isApprovedForAll(ownerId, actorId)) {
            throw new NotOwnerNorApprovedException(actorId, cardId);
        }

        ownership.setApprovedId(spenderId);
        ownershipRepository.save(ownership);
        log.info("Card {} approved for {} by {}", cardId, spenderId, actorId);
    }

    @Override
    @Transactional(readOnly = true)
    public String getApproved(long cardId) {
        return getOwnership(cardId).getApprovedId();
    }

    @Override
    @Transactional
    public void setApprovalForAll(String ownerId, String operatorId, boolean approved) {
        requireHolder(ownerId, "approval from an empty holder");
        requireHolder(operatorId, "approval of an empty operator");
        if (ownerId.equals(operatorId)) {
            throw new InvalidTransferException("Holder cannot approve itself as operator: " + ownerId);
        }

        boolean current = operatorApprovalRepository.existsByOwnerIdAndOperatorId(ownerId, operatorId);
        if (approved && !current) {
            operatorApprovalRepository.save(new OperatorApproval(ownerId, operatorId));
        } else if (!approved && current) {
            operatorApprovalRepository.deleteByOwnerIdAndOperatorId(ownerId, operatorId);
        }
        log.info("Operator {} {} for holder {}", operatorId, approved ? "approved" : "revoked", ownerId);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isApprovedForAll(String ownerId, String operatorId) {
        if (ownerId == null || operatorId == null) {
            return false;
        }
        return operatorApprovalRepository.existsByOwnerIdAndOperatorId(ownerId, operatorId);
    }

    private CardOwnership getOwnership(long cardId) {
        return ownershipRepository.findByCardId(cardId)
            .orElseThrow(() -> new CardNotFoundException(cardId));
    }

    /**
     * Swap-and-pop: the owner's last card takes over the leaving card's index.
     */
    private void removeFromOwnerEnumeration(CardOwnership leaving) {
        String ownerId = leaving.getOwnerId();
        long lastIndex = ownershipRepository.countByOwnerId(ownerId) - 1;
        if (leaving.getOwnerIndex() == lastIndex) {
            return;
        }

        CardOwnership last = ownershipRepository.findByOwnerIdAndOwnerIndex(ownerId, lastIndex)
            .orElseThrow(() -> new IllegalStateException(String.format(
                "Enumeration of %s is corrupt: no card at last index %d", ownerId, lastIndex)));
        last.reindex(leaving.getOwnerIndex());
        ownershipRepository.save(last);
    }

    private void requireNotHalted(String operation) {
        if (haltSwitch.isHalted()) {
            throw new RegistryHaltedException(operation);
        }
    }

    private static void requireHolder(String holderId, String message) {
        if (holderId == null || holderId.isBlank()) {
            throw new InvalidTransferException("Invalid transfer: " + message);
        }
    }
}
