package com.fintech.paymentengine.gateway;

import org.apache.commons.codec.binary.Hex;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.MessageDigest;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Collection;
import java.util.Locale;

/**
 * Signature schemes shared by gateway adapters.
 */
public final class CallbackSignatures {

    private static final String HMAC_SHA256 = "HmacSHA256";

    private CallbackSignatures() {
    }

    public static String hmacSha256Hex(String secret, String payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            return Hex.encodeHexString(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 is not available", e);
        }
    }

    /**
     * Accepts the signature if any of the secrets produced it, so that secrets can be rotated
     * without dropping callbacks signed with the previous one.
     */
    public static boolean isValidHmacSha256(Collection<String> secrets, String payload, String signatureHex) {
        if (signatureHex == null || payload == null || secrets == null) {
            return false;
        }
        byte[] presented = signatureHex.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        boolean valid = false;
        for (String secret : secrets) {
            if (secret == null || secret.isBlank()) {
                continue;
            }
            byte[] expected = hmacSha256Hex(secret, payload).getBytes(StandardCharsets.US_ASCII);
            // no early exit, every secret is compared
            valid |= MessageDigest.isEqual(expected, presented);
        }
        return valid;
    }

    /**
     * Verifies a base64 RSA-SHA256 signature against an X.509 public key in PEM or bare base64 form.
     */
    public static boolean isValidRsaSha256(String publicKeyPem, String payload, String signatureBase64) {
        if (publicKeyPem == null || payload == null || signatureBase64 == null) {
            return false;
        }
        try {
            Signature verifier = Signature.getInstance("SHA256withRSA");
            verifier.initVerify(parsePublicKey(publicKeyPem));
            verifier.update(payload.getBytes(StandardCharsets.UTF_8));
            return verifier.verify(Base64.getDecoder().decode(signatureBase64.trim()));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            return false;
        }
    }

    static PublicKey parsePublicKey(String pem) throws GeneralSecurityException {
        String base64 = pem
                .replace("-----BEGIN PUBLIC KEY-----", "")
                .replace("-----END PUBLIC KEY-----", "")
                .replaceAll("\\s", "");
        byte[] der = Base64.getDecoder().decode(base64);
        return KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
    }
}
