package com.cardregistry.metadata;

import com.cardregistry.common.UInt128;
import com.cardregistry.common.exception.WrongInputParamsException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.List;

/**
 * The level to URI table. A level without an entry reads as the empty string.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LevelUriCatalog {

    private final LevelUriRepository levelUriRepository;

    @Transactional(readOnly = true)
    public String uriOf(BigInteger level) {
        return levelUriRepository.findById(level)
            .map(LevelUri::getUri)
            .orElse("");
    }

    /**
     * Set or replace one level's URI. An empty URI removes the entry.
     */
    @Transactional
    public void put(BigInteger level, String uri) {
        UInt128.require(level, "level");
        if (uri == null || uri.isEmpty()) {
            levelUriRepository.findById(level).ifPresent(levelUriRepository::delete);
            log.info("Cleared URI of level {}", level);
            return;
        }

        LevelUri entry = levelUriRepository.findById(level)
            .orElseGet(() -> new LevelUri(level, uri));
        entry.changeUri(uri);
        levelUriRepository.save(entry);
        log.info("Set URI of level {} to {}", level, uri);
    }

    @Transactional
    public void putAll(List<BigInteger> levels, List<String> uris) {
        if (levels.isEmpty() || levels.size() != uris.size()) {
            throw new WrongInputParamsException(levels.size(), uris.size());
        }
        for (int i = 0; i < levels.size(); i++) {
            put(levels.get(i), uris.get(i));
        }
    }
}
