package dev.flyzex.bot.adapter.outbound.storage;

import dev.flyzex.bot.port.outbound.StoragePersistenceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalStorageAdapterTest {

    @TempDir
    Path tempDir;

    private final LocalStorageAdapter adapter = new LocalStorageAdapter();

    @Test
    void shouldReturnNullForMissingFile() throws Exception {
        String path = tempDir.resolve("missing.enc").toString();

        assertNull(adapter.getObject(path).get());
        assertFalse(Files.exists(Path.of(path)));
    }

    @Test
    void shouldWriteAndReadBack() throws Exception {
        String path = tempDir.resolve("nested/dir/storage.enc").toString();
        byte[] content = "token".getBytes(StandardCharsets.UTF_8);

        adapter.putObjectAtomic(path, content, false).get();

        assertTrue(Files.exists(Path.of(path)));
        assertArrayEquals(content, adapter.getObject(path).get());
        assertFalse(Files.exists(tempDir.resolve("nested/dir/storage.enc.tmp")));
    }

    @Test
    void shouldKeepBackupOfPreviousContent() throws Exception {
        Path target = tempDir.resolve("storage.enc");
        adapter.putObjectAtomic(target.toString(), "v1".getBytes(StandardCharsets.UTF_8), true).get();
        adapter.putObjectAtomic(target.toString(), "v2".getBytes(StandardCharsets.UTF_8), true).get();

        assertEquals("v2", Files.readString(target));
        assertEquals("v1", Files.readString(tempDir.resolve("storage.enc.bak")));
    }

    @Test
    void shouldCreateParentDirectory() throws Exception {
        Path target = tempDir.resolve("a/b/storage.enc");

        adapter.ensureParentDirectory(target.toString()).get();

        assertTrue(Files.isDirectory(tempDir.resolve("a/b")));
    }

    @Test
    void shouldLeaveTargetUntouchedWhenWriteFails() throws Exception {
        Path target = tempDir.resolve("storage.enc");
        Files.writeString(target, "committed");
        LocalStorageAdapter failing = new LocalStorageAdapter() {
            @Override
            protected void writeTempFile(Path tempPath, byte[] content) throws IOException {
                Files.write(tempPath, new byte[] { 1, 2 });
                throw new IOException("disk full");
            }
        };

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> failing.putObjectAtomic(target.toString(), "next".getBytes(StandardCharsets.UTF_8), false)
                        .get());

        assertInstanceOf(StoragePersistenceException.class, error.getCause());
        assertEquals("committed", Files.readString(target));
        assertFalse(Files.exists(tempDir.resolve("storage.enc.tmp")));
    }

    @Test
    void shouldRejectBlankPath() {
        ExecutionException error = assertThrows(ExecutionException.class, () -> adapter.getObject(" ").get());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }
}
