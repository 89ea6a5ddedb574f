package com.questrail.socket.server;

import com.questrail.socket.api.SocketError;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.api.UnixSocketServer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import static org.junit.jupiter.api.Assertions.*;

class UnixSocketFileTest {

    @TempDir
    Path dir;

    @Test
    void permissionIsCappedToMode() throws Exception {
        assertEquals(0777, UnixSocketFile.of(dir.resolve("a.sock").toString(), 07777).permission());
        assertEquals(0, UnixSocketFile.of(dir.resolve("a.sock").toString(), -5).permission());
        assertEquals(0660, UnixSocketFile.of(dir.resolve("a.sock").toString(), 0660).permission());
    }

    @Test
    void modeBitsMapToPosixPermissions() {
        assertEquals(PosixFilePermissions.fromString("rwxrwx---"), UnixSocketFile.toPermissions(0770));
        assertEquals(PosixFilePermissions.fromString("rw-r--r--"), UnixSocketFile.toPermissions(0644));
        assertEquals(PosixFilePermissions.fromString("---------"), UnixSocketFile.toPermissions(0));
    }

    @Test
    void groupIdMustBeInRange() throws Exception {
        String path = dir.resolve("g.sock").toString();

        assertDoesNotThrow(() -> UnixSocketFile.of(path, 0770, 0));
        assertDoesNotThrow(() -> UnixSocketFile.of(path, 0770, UnixSocketServer.MAX_GID));

        SocketErrorException negative = assertThrows(SocketErrorException.class, () -> UnixSocketFile.of(path, 0770, -1));
        assertEquals(SocketError.INVALID_GROUP, negative.error());
        SocketErrorException tooLarge = assertThrows(SocketErrorException.class,
                () -> UnixSocketFile.of(path, 0770, UnixSocketServer.MAX_GID + 1));
        assertEquals(SocketError.INVALID_GROUP, tooLarge.error());
    }

    @Test
    void regularFileIsNotTreatedAsStaleSocket() throws Exception {
        Path path = dir.resolve("data.txt");
        Files.writeString(path, "keep me");

        UnixSocketFile.of(path.toString(), 0770).removeStale();

        assertTrue(Files.exists(path));
    }

    @Test
    void deleteIsQuietWhenNothingIsThere() throws Exception {
        UnixSocketFile file = UnixSocketFile.of(dir.resolve("missing.sock").toString(), 0770);

        assertDoesNotThrow(file::delete);
    }
}
