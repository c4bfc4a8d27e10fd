package com.liquidswap.sdk.invoice;

import com.liquidswap.domain.LiquidNetwork;
import com.liquidswap.error.PaymentException;
import org.bitcoinj.core.Utils;

import java.time.Instant;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The parts of a BOLT11 invoice the swap flows need: currency prefix, amount, creation time, expiry and payment
 * hash. The bech32 checksum is verified; the signature is not.
 *
 * @param amountMsat null for invoices without an amount
 * @param paymentHash hex, null when the invoice carries no {@code p} field
 */
public record Bolt11Invoice(String bolt11, String currency, Long amountMsat, long timestamp, long expirySeconds,
                            String paymentHash) {

    public static final long DEFAULT_EXPIRY_SECONDS = 3600;

    private static final Pattern HRP = Pattern.compile("^ln(bcrt|bc|tbs|tb)(\\d*)([munp]?)$");
    private static final String CHARSET = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";
    private static final int TIMESTAMP_WORDS = 7;
    private static final int SIGNATURE_WORDS = 104;
    private static final int CHECKSUM_WORDS = 6;
    private static final int TAG_PAYMENT_HASH = 1;
    private static final int TAG_EXPIRY = 6;

    /**
     * @throws PaymentException {@code InvalidInvoice} when the string is not a well-formed BOLT11 invoice
     */
    public static Bolt11Invoice parse(String invoice) {
        if (invoice == null || invoice.isBlank()) {
            throw PaymentException.invalidInvoice();
        }
        String trimmed = invoice.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (!lower.equals(trimmed) && !trimmed.toUpperCase(Locale.ROOT).equals(trimmed)) {
            throw PaymentException.invalidInvoice();
        }
        if (lower.startsWith("lightning:")) {
            lower = lower.substring("lightning:".length());
        }
        int separator = lower.lastIndexOf('1');
        if (separator < 3) {
            throw PaymentException.invalidInvoice();
        }
        String hrp = lower.substring(0, separator);
        Matcher matcher = HRP.matcher(hrp);
        if (!matcher.matches()) {
            throw PaymentException.invalidInvoice();
        }
        int[] words = toWords(lower.substring(separator + 1));
        if (words.length < TIMESTAMP_WORDS + SIGNATURE_WORDS + CHECKSUM_WORDS || !verifyChecksum(hrp, words)) {
            throw PaymentException.invalidInvoice();
        }

        Long amountMsat = amountMsat(matcher.group(2), matcher.group(3));
        long timestamp = readNumber(words, 0, TIMESTAMP_WORDS);
        long expiry = DEFAULT_EXPIRY_SECONDS;
        String paymentHash = null;
        int end = words.length - SIGNATURE_WORDS - CHECKSUM_WORDS;
        int pos = TIMESTAMP_WORDS;
        while (pos < end) {
            if (pos + 3 > end) {
                throw PaymentException.invalidInvoice();
            }
            int tag = words[pos];
            int length = words[pos + 1] * 32 + words[pos + 2];
            int dataStart = pos + 3;
            if (dataStart + length > end) {
                throw PaymentException.invalidInvoice();
            }
            if (tag == TAG_PAYMENT_HASH && length == 52) {
                paymentHash = Utils.HEX.encode(toBytes(words, dataStart, length));
            } else if (tag == TAG_EXPIRY && length > 0 && length <= 12) {
                expiry = readNumber(words, dataStart, length);
            }
            pos = dataStart + length;
        }
        return new Bolt11Invoice(lower, matcher.group(1), amountMsat, timestamp, expiry, paymentHash);
    }

    /** Amount rounded up to whole satoshis; null for amountless invoices. */
    public Long amountSat() {
        return amountMsat == null ? null : (amountMsat + 999) / 1000;
    }

    public boolean isExpiredAt(Instant now) {
        return now.getEpochSecond() > timestamp + expirySeconds;
    }

    /** Lightning currency prefix the swap counterparty accepts on the given Liquid network. */
    public boolean isFor(LiquidNetwork network) {
        return switch (network) {
            case MAINNET -> "bc".equals(currency);
            case TESTNET -> "tb".equals(currency);
            case REGTEST -> "bcrt".equals(currency);
        };
    }

    private static Long amountMsat(String digits, String multiplier) {
        if (digits.isEmpty()) {
            if (!multiplier.isEmpty()) {
                throw PaymentException.invalidInvoice();
            }
            return null;
        }
        if (digits.length() > 1 && digits.charAt(0) == '0') {
            throw PaymentException.invalidInvoice();
        }
        try {
            long value = Long.parseLong(digits);
            long msat = switch (multiplier) {
                case "" -> Math.multiplyExact(value, 100_000_000_000L);
                case "m" -> Math.multiplyExact(value, 100_000_000L);
                case "u" -> Math.multiplyExact(value, 100_000L);
                case "n" -> Math.multiplyExact(value, 100L);
                case "p" -> {
                    if (value % 10 != 0) {
                        throw PaymentException.invalidInvoice();
                    }
                    yield value / 10;
                }
                default -> throw PaymentException.invalidInvoice();
            };
            if (msat <= 0) {
                throw PaymentException.invalidInvoice();
            }
            return msat;
        } catch (NumberFormatException | ArithmeticException e) {
            throw PaymentException.invalidInvoice();
        }
    }

    private static int[] toWords(String data) {
        int[] words = new int[data.length()];
        for (int i = 0; i < data.length(); i++) {
            int value = CHARSET.indexOf(data.charAt(i));
            if (value < 0) {
                throw PaymentException.invalidInvoice();
            }
            words[i] = value;
        }
        return words;
    }

    private static long readNumber(int[] words, int from, int count) {
        long value = 0;
        for (int i = from; i < from + count; i++) {
            value = (value << 5) | words[i];
        }
        return value;
    }

    /** Packs 5-bit words into bytes, dropping the trailing padding bits. */
    private static byte[] toBytes(int[] words, int from, int count) {
        byte[] out = new byte[count * 5 / 8];
        int acc = 0;
        int bits = 0;
        int index = 0;
        for (int i = from; i < from + count && index < out.length; i++) {
            acc = (acc << 5) | words[i];
            bits += 5;
            if (bits >= 8) {
                bits -= 8;
                out[index++] = (byte) ((acc >> bits) & 0xff);
            }
        }
        return out;
    }

    private static boolean verifyChecksum(String hrp, int[] words) {
        int chk = 1;
        for (int i = 0; i < hrp.length(); i++) {
            chk = polymodStep(chk, hrp.charAt(i) >> 5);
        }
        chk = polymodStep(chk, 0);
        for (int i = 0; i < hrp.length(); i++) {
            chk = polymodStep(chk, hrp.charAt(i) & 31);
        }
        for (int word : words) {
            chk = polymodStep(chk, word);
        }
        return chk == 1;
    }

    private static int polymodStep(int chk, int value) {
        int top = chk >>> 25;
        chk = ((chk & 0x1ffffff) << 5) ^ value;
        if ((top & 1) != 0) {
            chk ^= 0x3b6a57b2;
        }
        if ((top & 2) != 0) {
            chk ^= 0x26508e6d;
        }
        if ((top & 4) != 0) {
            chk ^= 0x1ea119fa;
        }
        if ((top & 8) != 0) {
            chk ^= 0x3d4233dd;
        }
        if ((top & 16) != 0) {
            chk ^= 0x2a1462b3;
        }
        return chk;
    }
}
