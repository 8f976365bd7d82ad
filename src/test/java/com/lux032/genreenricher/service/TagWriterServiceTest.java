package com.lux032.genreenricher.service;

import com.lux032.genreenricher.config.EnricherConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TagWriterServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldRejectWriteToMissingFile() {
        TagWriterService service = new TagWriterService(EnricherConfig.defaults());
        File missing = tempDir.resolve("missing.mp3").toFile();

        assertThatThrownBy(() -> service.writeTags(missing, Collections.singletonList("Rock"), null, null))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("does not exist");
    }

    @Test
    void shouldWrapUnreadableAudio() throws IOException {
        TagWriterService service = new TagWriterService(EnricherConfig.defaults());
        Path notAudio = tempDir.resolve("notes.txt");
        Files.write(notAudio, "not an mp3".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> service.readTags(notAudio.toFile()))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("notes.txt");
    }

    @Test
    void shouldBackupNextToOriginal() throws IOException {
        TagWriterService service = new TagWriterService(EnricherConfig.defaults());
        Path original = tempDir.resolve("song.mp3");
        Files.write(original, new byte[]{1, 2, 3});

        Path backup = service.createBackup(original.toFile());

        assertThat(backup.getParent()).isEqualTo(tempDir.toAbsolutePath());
        assertThat(backup.getFileName().toString()).startsWith("song.mp3.backup_");
        assertThat(Files.readAllBytes(backup)).containsExactly(1, 2, 3);
    }

    @Test
    void shouldBackupToConfiguredDirectory() throws IOException {
        EnricherConfig config = EnricherConfig.defaults();
        config.setBackupDirectory(tempDir.resolve("backups").toString());
        TagWriterService service = new TagWriterService(config);
        Path original = tempDir.resolve("song.mp3");
        Files.write(original, new byte[]{9});

        Path backup = service.createBackup(original.toFile());

        assertThat(backup.getParent()).isEqualTo(tempDir.resolve("backups"));
        assertThat(backup).exists();
    }
}
