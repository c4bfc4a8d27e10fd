package com.liquidswap.wallet;

import com.liquidswap.domain.LiquidNetwork;
import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.Base58;
import org.bitcoinj.core.Bech32;

import java.io.ByteArrayOutputStream;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validates Liquid addresses for one network: confidential blech32, unconfidential bech32/bech32m and
 * (confidential or plain) base58. Blech32 addresses are checked for charset, prefix and payload shape only.
 */
public class LiquidAddressValidator {

    private static final String CHARSET = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";
    private static final Pattern BLECH32 = Pattern.compile("^[a-z]{2,4}1[" + CHARSET + "]{60,140}$");
    private static final int BLECH32_CHECKSUM_LENGTH = 12;
    private static final int BLINDING_KEY_LENGTH = 33;

    private final LiquidNetwork network;

    public LiquidAddressValidator(LiquidNetwork network) {
        this.network = network;
    }

    public boolean isValid(String address) {
        if (address == null || address.isBlank()) {
            return false;
        }
        String trimmed = address.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (!trimmed.equals(lower) && !trimmed.equals(trimmed.toUpperCase(Locale.ROOT))) {
            if (isBase58Shaped(trimmed)) {
                return isValidBase58(trimmed);
            }
            return false;
        }
        if (lower.startsWith(blech32Hrp() + "1")) {
            return isValidBlech32(lower);
        }
        if (lower.startsWith(bech32Hrp() + "1")) {
            return isValidBech32(lower);
        }
        return isValidBase58(trimmed);
    }

    String blech32Hrp() {
        return switch (network) {
            case MAINNET -> "lq";
            case TESTNET -> "tlq";
            case REGTEST -> "el";
        };
    }

    String bech32Hrp() {
        return switch (network) {
            case MAINNET -> "ex";
            case TESTNET -> "tex";
            case REGTEST -> "ert";
        };
    }

    private int confidentialPrefix() {
        return switch (network) {
            case MAINNET -> 12;
            case TESTNET -> 23;
            case REGTEST -> 4;
        };
    }

    private int p2pkhVersion() {
        return switch (network) {
            case MAINNET -> 57;
            case TESTNET -> 36;
            case REGTEST -> 235;
        };
    }

    private int p2shVersion() {
        return switch (network) {
            case MAINNET -> 39;
            case TESTNET -> 19;
            case REGTEST -> 75;
        };
    }

    private boolean isValidBlech32(String address) {
        if (!BLECH32.matcher(address).matches()) {
            return false;
        }
        String payload = address.substring(blech32Hrp().length() + 1, address.length() - BLECH32_CHECKSUM_LENGTH);
        byte[] values = new byte[payload.length()];
        for (int i = 0; i < payload.length(); i++) {
            values[i] = (byte) CHARSET.indexOf(payload.charAt(i));
        }
        int version = values[0];
        byte[] program = convertBits(values, 1, values.length - 1);
        if (program == null || version > 16) {
            return false;
        }
        int witnessLength = program.length - BLINDING_KEY_LENGTH;
        return isValidWitnessProgram(version, witnessLength) && (program[0] == 0x02 || program[0] == 0x03);
    }

    private boolean isValidBech32(String address) {
        Bech32.Bech32Data decoded;
        try {
            decoded = Bech32.decode(address);
        } catch (AddressFormatException e) {
            return false;
        }
        if (!bech32Hrp().equals(decoded.hrp) || decoded.data.length < 1) {
            return false;
        }
        int version = decoded.data[0];
        if (version > 16) {
            return false;
        }
        Bech32.Encoding expected = version == 0 ? Bech32.Encoding.BECH32 : Bech32.Encoding.BECH32M;
        if (decoded.encoding != expected) {
            return false;
        }
        byte[] program = convertBits(decoded.data, 1, decoded.data.length - 1);
        return program != null && isValidWitnessProgram(version, program.length);
    }

    private boolean isValidBase58(String address) {
        if (!isBase58Shaped(address)) {
            return false;
        }
        byte[] decoded;
        try {
            decoded = Base58.decodeChecked(address);
        } catch (AddressFormatException e) {
            return false;
        }
        if (decoded.length == 21) {
            return isScriptVersion(decoded[0] & 0xff);
        }
        if (decoded.length == 2 + BLINDING_KEY_LENGTH + 20) {
            int blindingPrefix = decoded[2] & 0xff;
            return (decoded[0] & 0xff) == confidentialPrefix()
                    && isScriptVersion(decoded[1] & 0xff)
                    && (blindingPrefix == 0x02 || blindingPrefix == 0x03);
        }
        return false;
    }

    private boolean isScriptVersion(int version) {
        return version == p2pkhVersion() || version == p2shVersion();
    }

    private static boolean isBase58Shaped(String address) {
        return address.matches("^[1-9A-HJ-NP-Za-km-z]{26,90}$");
    }

    private static boolean isValidWitnessProgram(int version, int length) {
        if (version == 0) {
            return length == 20 || length == 32;
        }
        return length >= 2 && length <= 40;
    }

    /** 5-bit groups to bytes; null when the padding is not zero or too long. */
    private static byte[] convertBits(byte[] in, int offset, int length) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(length * 5 / 8);
        int acc = 0;
        int bits = 0;
        for (int i = offset; i < offset + length; i++) {
            int value = in[i] & 0xff;
            if (value >> 5 != 0) {
                return null;
            }
            acc = (acc << 5) | value;
            bits += 5;
            while (bits >= 8) {
                bits -= 8;
                out.write((acc >> bits) & 0xff);
            }
        }
        if (bits >= 5 || ((acc << (8 - bits)) & 0xff) != 0) {
            return null;
        }
        return out.toByteArray();
    }
}
