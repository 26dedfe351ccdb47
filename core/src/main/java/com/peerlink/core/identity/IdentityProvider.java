package com.peerlink.core.identity;

import com.peerlink.core.util.BytesUtils;
import com.peerlink.core.util.JsonCodecException;
import com.peerlink.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.util.Arrays;

/**
 * Loads the process identity from disk, generating and persisting it on first start.
 * <p>
 * The file is written once. A file that exists but cannot be read is an error: replacing it
 * would silently give the process a new DID and orphan every config that names the old one.
 * </p>
 */
public final class IdentityProvider {
    private static final Logger log = LoggerFactory.getLogger(IdentityProvider.class);

    public static final String DEFAULT_FILE_NAME = "bridge-identity.json";

    /**
     * X.509 SubjectPublicKeyInfo and PKCS#8 headers for Ed25519 are fixed length; the raw key
     * material is the trailing 32 bytes of both encodings.
     */
    private static final int ED25519_KEY_LENGTH = 32;

    private IdentityProvider() {
    }

    public static Identity loadOrCreate(Path dataDir) {
        return loadOrCreate(dataDir, DEFAULT_FILE_NAME);
    }

    public static Identity loadOrCreate(Path dataDir, String fileName) {
        Path file = dataDir.resolve(fileName);
        if (Files.exists(file)) {
            Identity identity = read(file);
            log.info("Loaded identity {} from {}", identity.getDid(), file);
            return identity;
        }

        Identity identity = generate();
        write(dataDir, file, identity);
        log.info("Generated new identity {} at {}", identity.getDid(), file);
        return identity;
    }

    public static Identity generate() {
        KeyPair keyPair;
        try {
            keyPair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 is not available in this JVM", e);
        }
        byte[] publicKey = tail(keyPair.getPublic().getEncoded());
        byte[] privateKey = tail(keyPair.getPrivate().getEncoded());
        return new Identity(DidKey.fromEd25519PublicKey(publicKey), BytesUtils.toHex(publicKey), BytesUtils.toHex(privateKey));
    }

    private static Identity read(Path file) {
        try {
            Identity identity = JsonUtils.readValue(Files.readString(file, StandardCharsets.UTF_8), Identity.class);
            if (identity.getDid() == null || !identity.getDid().startsWith("did:")) {
                throw new IllegalStateException("Identity file " + file + " has no valid did");
            }
            return identity;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read identity file " + file, e);
        } catch (JsonCodecException e) {
            throw new IllegalStateException("Identity file " + file + " is corrupt", e);
        }
    }

    private static void write(Path dataDir, Path file, Identity identity) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(dataDir);
            Files.writeString(tmp, JsonUtils.writeValueAsString(identity), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist identity to " + file, e);
        }
    }

    private static byte[] tail(byte[] encoded) {
        return Arrays.copyOfRange(encoded, encoded.length - ED25519_KEY_LENGTH, encoded.length);
    }
}
