package com.liquidswap.wallet.signer;

import org.bitcoinj.crypto.ChildNumber;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses textual BIP32 paths ({@code m/84'/1776'/0'}, hardened markers {@code '}, {@code h} or {@code H}).
 */
public final class Bip32Paths {

    private Bip32Paths() {
    }

    public static List<ChildNumber> parse(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Empty derivation path");
        }
        String[] parts = path.trim().split("/");
        int start = "m".equalsIgnoreCase(parts[0]) ? 1 : 0;
        List<ChildNumber> children = new ArrayList<>(parts.length);
        for (int i = start; i < parts.length; i++) {
            String part = parts[i].trim();
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Empty path element in " + path);
            }
            char last = part.charAt(part.length() - 1);
            boolean hardened = last == '\'' || last == 'h' || last == 'H';
            String digits = hardened ? part.substring(0, part.length() - 1) : part;
            int index;
            try {
                index = Integer.parseInt(digits);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid path element '" + part + "' in " + path, e);
            }
            if (index < 0) {
                throw new IllegalArgumentException("Negative path element in " + path);
            }
            children.add(new ChildNumber(index, hardened));
        }
        return children;
    }
}
