package com.questrail.socket.server;

import com.questrail.socket.api.SocketError;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.api.UnixSocketServer;
import com.questrail.socket.core.SocketAddresses;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.UnixDomainSocketAddress;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Set;

/**
 * UnixSocketFile
 * -----------------------------------------------------------------------------
 * The filesystem side of a Unix server socket: stale file removal before
 * bind, mode and group after bind, deletion after the server stops.
 */
public final class UnixSocketFile
{
    private static final Logger log = LoggerFactory.getLogger(UnixSocketFile.class);

    private static final int MODE_MASK = 0777;
    private static final int NO_GROUP = -1;

    private final Path path;
    private final int permission;
    private final int groupId;

    private UnixSocketFile(Path path, int permission, int groupId) {
        this.path = path;
        this.permission = permission;
        this.groupId = groupId;
    }

    /**
     * @param permission mode bits, capped to {@code 0777}
     */
    public static UnixSocketFile of(String path, int permission) throws SocketErrorException {
        return new UnixSocketFile(SocketAddresses.unixPath(path), clampPermission(permission), NO_GROUP);
    }

    /**
     * @throws SocketErrorException {@code INVALID_GROUP} outside {@code [0, MAX_GID]}
     */
    public static UnixSocketFile of(String path, int permission, int groupId) throws SocketErrorException {
        if (groupId < 0 || groupId > UnixSocketServer.MAX_GID) {
            throw new SocketErrorException(SocketError.INVALID_GROUP, Integer.toString(groupId));
        }
        return new UnixSocketFile(SocketAddresses.unixPath(path), clampPermission(permission), groupId);
    }

    static int clampPermission(int permission) {
        if (permission < 0) {
            return 0;
        }
        return Math.min(permission, MODE_MASK);
    }

    public Path path() {
        return path;
    }

    public int permission() {
        return permission;
    }

    public UnixDomainSocketAddress address() {
        return UnixDomainSocketAddress.of(path);
    }

    /**
     * Remove a socket file left behind by an earlier run. Regular files and
     * directories are left alone, so the bind fails on them.
     */
    public void removeStale() throws IOException {
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        if (attrs.isOther()) {
            log.debug("Removing stale socket file {}", path);
            Files.deleteIfExists(path);
        }
    }

    /**
     * Apply the mode and, when one was given, the owning group.
     */
    public void applyAttributes() throws IOException {
        Files.setPosixFilePermissions(path, toPermissions(permission));
        if (groupId != NO_GROUP) {
            Files.setAttribute(path, "unix:gid", groupId, LinkOption.NOFOLLOW_LINKS);
        }
    }

    public void delete() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove socket file {}", path, e);
        }
    }

    static Set<PosixFilePermission> toPermissions(int mode) {
        Set<PosixFilePermission> perms = EnumSet.noneOf(PosixFilePermission.class);
        PosixFilePermission[] order = {
                PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE, PosixFilePermission.OWNER_EXECUTE,
                PosixFilePermission.GROUP_READ, PosixFilePermission.GROUP_WRITE, PosixFilePermission.GROUP_EXECUTE,
                PosixFilePermission.OTHERS_READ, PosixFilePermission.OTHERS_WRITE, PosixFilePermission.OTHERS_EXECUTE,
        };
        for (int i = 0; i < order.length; i++) {
            if ((mode & (0400 >> i)) != 0) {
                perms.add(order[i]);
            }
        }
        return perms;
    }

    @Override
    public String toString() {
        return path + " (" + Integer.toOctalString(permission) + (groupId == NO_GROUP ? "" : ", gid " + groupId) + ")";
    }
}
