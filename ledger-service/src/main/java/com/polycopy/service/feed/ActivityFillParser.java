package com.polycopy.service.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.polycopy.domain.FillEvent;
import com.polycopy.domain.TradeSide;
import com.polycopy.error.InvalidEventException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns a Polymarket data-api {@code /activity} payload into fills ready for classification.
 *
 * Flow:
 * 1. Rows without a transaction hash, non-trade rows and rows from other wallets are dropped
 * 2. Rows whose transaction hash was already seen are dropped
 * 3. Remaining fills are returned oldest first (the API answers newest first)
 *
 * Parsing does not mark anything seen; the caller marks each fill once it has taken it in.
 */
@Slf4j
public class ActivityFillParser {

    private final String targetWallet;
    private final Set<String> seenTransactionHashes = ConcurrentHashMap.newKeySet();

    /**
     * @param targetWallet proxy wallet to keep, lower-case; {@code null} keeps every wallet
     */
    public ActivityFillParser(String targetWallet) {
        this(targetWallet, List.of());
    }

    /**
     * @param seenTransactionHashes hashes taken in before a restart
     */
    public ActivityFillParser(String targetWallet, Collection<String> seenTransactionHashes) {
        this.targetWallet = targetWallet == null ? null : targetWallet.toLowerCase(Locale.ROOT);
        this.seenTransactionHashes.addAll(seenTransactionHashes);
    }

    public List<FillEvent> parse(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return List.of();
        }
        if (!payload.isArray()) {
            log.warn("Expected an array of activity rows, got {}", payload.getNodeType());
            return List.of();
        }

        List<FillEvent> fills = new ArrayList<>();
        Set<String> inBatch = new HashSet<>();
        for (JsonNode row : payload) {
            String hash = text(row, "transactionHash");
            if (hash == null || seenTransactionHashes.contains(hash) || inBatch.contains(hash)) {
                continue;
            }
            String type = text(row, "type");
            if (type != null && !"TRADE".equalsIgnoreCase(type)) {
                continue;
            }
            if (targetWallet != null) {
                String wallet = firstText(row, "proxyWallet", "user");
                if (wallet == null || !targetWallet.equals(wallet.toLowerCase(Locale.ROOT))) {
                    continue;
                }
            }

            try {
                fills.add(toFill(row, hash));
                inBatch.add(hash);
            } catch (InvalidEventException | NumberFormatException e) {
                log.warn("Failed to parse activity {}: {}", hash, e.getMessage());
            }
        }

        Collections.reverse(fills);
        fills.sort(Comparator.comparing(FillEvent::timestamp));
        return fills;
    }

    /**
     * @return {@code false} if the transaction was already seen
     */
    public boolean markSeen(String transactionHash) {
        return seenTransactionHashes.add(transactionHash);
    }

    public int seenCount() {
        return seenTransactionHashes.size();
    }

    public Set<String> seenTransactionHashes() {
        return Collections.unmodifiableSet(new TreeSet<>(seenTransactionHashes));
    }

    private static FillEvent toFill(JsonNode row, String hash) {
        JsonNode ts = row.get("timestamp");
        if (ts == null || !ts.canConvertToLong()) {
            throw new InvalidEventException("missing timestamp");
        }
        return new FillEvent(
                hash,
                text(row, "asset"),
                firstText(row, "conditionId", "market"),
                text(row, "outcome"),
                TradeSide.parse(text(row, "side")),
                decimal(row, "size"),
                decimal(row, "price"),
                Instant.ofEpochSecond(ts.asLong())
        );
    }

    private static BigDecimal decimal(JsonNode row, String field) {
        JsonNode node = row.get(field);
        if (node == null || node.isNull()) {
            throw new InvalidEventException("missing " + field);
        }
        return node.isNumber() ? node.decimalValue() : new BigDecimal(node.asText().trim());
    }

    private static String firstText(JsonNode row, String... fields) {
        for (String field : fields) {
            String value = text(row, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode row, String field) {
        JsonNode node = row.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
