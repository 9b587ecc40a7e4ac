package com.cardregistry.lifecycle;

import com.cardregistry.ledger.CardTransferredEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Writes registry notifications to the log.
 *
 * Notifications are delivered once the publishing transaction has committed; a call
 * that rolls back, including a batch failing halfway, emits nothing.
 */
@Component
@Slf4j
public class CardActivityListener {

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onCardUsed(CardUsedEvent event) {
        log.info("Used: card={}, remainingUses={}", event.getCardId(), event.getRemainingUses());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onCardTransferred(CardTransferredEvent event) {
        if (event.isMint()) {
            log.info("Minted: card={}, to={}", event.getCardId(), event.getTo());
        } else if (event.isBurn()) {
            log.info("Burned: card={}, from={}", event.getCardId(), event.getFrom());
        } else {
            log.info("Transferred: card={}, from={}, to={}", event.getCardId(), event.getFrom(), event.getTo());
        }
    }
}
