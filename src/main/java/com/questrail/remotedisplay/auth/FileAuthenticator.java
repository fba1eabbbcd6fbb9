package com.questrail.remotedisplay.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Arrays;
import java.util.Objects;
import java.util.Set;

/**
 * Shared secret read from a file, verified with hmac digests only.
 *
 * <p>The file is read when a response is checked and re-read only when its
 * modification time changes. A trailing newline is stripped. A missing or
 * unreadable file rejects.</p>
 */
public final class FileAuthenticator extends AbstractChallengeAuthenticator
{
    private static final Logger log = LoggerFactory.getLogger(FileAuthenticator.class);

    private final Path file;

    private FileTime loadedAt;
    private byte[] password;

    public FileAuthenticator(String username, Path file)
    {
        super(username);
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public String name()
    {
        return "file";
    }

    public Path file()
    {
        return file;
    }

    @Override
    protected Set<Digest> supportedDigests()
    {
        return PasswordAuthenticator.HMAC_DIGESTS;
    }

    @Override
    protected boolean verify(AuthChallenge challenge, byte[] salt, byte[] response)
    {
        byte[] pw = loadPassword();
        return pw != null && checkPassword(challenge, salt, pw, response);
    }

    /**
     * @return the current password, or {@code null} when the file cannot be read
     */
    byte[] loadPassword()
    {
        try {
            FileTime modified = Files.getLastModifiedTime(file);
            if (password == null || !modified.equals(loadedAt)) {
                password = stripNewline(Files.readAllBytes(file));
                loadedAt = modified;
                log.debug("loaded password file {}", file);
            }
            return password;
        } catch (NoSuchFileException e) {
            log.error("password file {} does not exist", file);
        } catch (IOException e) {
            log.error("cannot read password file {}", file, e);
        }
        password = null;
        loadedAt = null;
        return null;
    }

    private static byte[] stripNewline(byte[] data)
    {
        int end = data.length;
        while (end > 0 && (data[end - 1] == '\n' || data[end - 1] == '\r')) {
            end--;
        }
        return Arrays.copyOf(data, end);
    }
}
