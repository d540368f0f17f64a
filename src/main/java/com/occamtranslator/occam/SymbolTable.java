package com.occamtranslator.occam;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Names declared so far in one parse, consulted where the grammar alone
 * cannot tell two constructs apart:
 *
 * <ul>
 * <li>timers: {@code t ? x} is a timer read rather than a channel input;</li>
 * <li>protocols: {@code c ! tag ; x} is a variant send when {@code tag} is a
 * tag of any variant protocol seen so far;</li>
 * <li>records: {@code POINT p:} is a variable declaration.</li>
 * </ul>
 *
 * Each {@link Parser} owns a fresh table. Declarations are only visible after
 * they have been parsed; there are no forward references.
 */
class SymbolTable {
    private final Set<String> timers = new HashSet<>();
    private final Map<String, Stmt.Protocol> protocols = new LinkedHashMap<>();
    private final Map<String, Stmt.Record> records = new LinkedHashMap<>();

    void declareTimer(String name) {
        timers.add(name);
    }

    boolean isTimer(String name) {
        return timers.contains(name);
    }

    void declareProtocol(Stmt.Protocol protocol) {
        protocols.put(protocol.name.lexeme, protocol);
    }

    Stmt.Protocol protocol(String name) {
        return protocols.get(name);
    }

    boolean isProtocol(String name) {
        return protocols.containsKey(name);
    }

    // Tags share one namespace across every variant protocol, whatever the
    // channel's declared protocol is.
    boolean isVariantTag(String name) {
        for (Stmt.Protocol protocol : protocols.values()) {
            if (protocol.hasTag(name)) return true;
        }
        return false;
    }

    void declareRecord(Stmt.Record record) {
        records.put(record.name.lexeme, record);
    }

    Stmt.Record record(String name) {
        return records.get(name);
    }

    boolean isRecord(String name) {
        return records.containsKey(name);
    }
}
