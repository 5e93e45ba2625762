package com.mobifone.broker.service.crypto;

import com.mobifone.broker.exception.AppException;
import com.mobifone.broker.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Scrambler-keyed symmetric cipher for the short-lived passwords exchanged with clients.
 * <p>
 * The client generates a scrambler per session and sends Base64(password XOR scrambler).
 * This only keeps credentials from being replayed across sessions or read from URLs and
 * logs at a glance; it is a client compatibility mechanism, not a cryptographic guarantee.
 */
@Slf4j
@Service
public class CredentialCipher {

    public String decrypt(String cipherText, String scrambler) {
        if (cipherText == null || scrambler == null || scrambler.isEmpty()) {
            log.warn("Credential decryption rejected: missing ciphertext or scrambler");
            throw new AppException(ErrorCode.DECRYPTION_ERROR);
        }
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(toStandardAlphabet(cipherText));
        } catch (IllegalArgumentException e) {
            log.warn("Credential decryption rejected: payload is not Base64 ({} chars)", cipherText.length());
            throw new AppException(ErrorCode.DECRYPTION_ERROR, e);
        }
        byte[] plain = xor(raw, scrambler.getBytes(StandardCharsets.UTF_8));
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(plain))
                    .toString();
        } catch (CharacterCodingException e) {
            log.warn("Credential decryption rejected: scrambler does not match payload");
            throw new AppException(ErrorCode.DECRYPTION_ERROR, e);
        }
    }

    public String encrypt(String plainText, String scrambler) {
        if (plainText == null || scrambler == null || scrambler.isEmpty()) {
            throw new AppException(ErrorCode.DECRYPTION_ERROR);
        }
        byte[] sealed = xor(plainText.getBytes(StandardCharsets.UTF_8), scrambler.getBytes(StandardCharsets.UTF_8));
        return Base64.getEncoder().encodeToString(sealed);
    }

    private static byte[] xor(byte[] data, byte[] key) {
        byte[] out = new byte[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = (byte) (data[i] ^ key[i % key.length]);
        }
        return out;
    }

    // query strings turn '+' into ' ', and some clients send the URL-safe alphabet
    private static String toStandardAlphabet(String value) {
        return value.trim().replace(' ', '+').replace('-', '+').replace('_', '/');
    }
}
