package org.calista.clausegraph.solve.aggregate;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Content-addressed parse run ids.
 *
 * <p>{@code p2_} + the first 16 hex chars of SHA-1 over
 * {@code section_key|sorted(selected ids)|sorted(abstained ids)} joined with {@code '|'} (UTF-8).
 * The digest is part of the persisted contract; changing it invalidates stored ids.</p>
 */
public final class RunIds {

    public static final String PREFIX = "p2_";
    public static final String DIGEST = "SHA-1";
    public static final int HEX_CHARS = 16;

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private RunIds() {}

    public static String parseRunId(String sectionKey,
                                    Collection<String> selectedNodeIds,
                                    Collection<String> abstainedTokenIds) {
        List<String> parts = new ArrayList<>();
        parts.add(sectionKey == null ? "" : sectionKey);
        parts.addAll(sorted(selectedNodeIds));
        parts.addAll(sorted(abstainedTokenIds));

        byte[] digest = digest(String.join("|", parts).getBytes(StandardCharsets.UTF_8));
        return PREFIX + hex(digest).substring(0, HEX_CHARS);
    }

    private static List<String> sorted(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) return List.of();
        List<String> out = new ArrayList<>(ids);
        Collections.sort(out);
        return out;
    }

    private static byte[] digest(byte[] payload) {
        try {
            return MessageDigest.getInstance(DIGEST).digest(payload);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-1
            throw new IllegalStateException(DIGEST + " unavailable", e);
        }
    }

    private static String hex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xff;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0f];
        }
        return new String(out);
    }
}
