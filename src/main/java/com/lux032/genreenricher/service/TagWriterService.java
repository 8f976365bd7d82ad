package com.lux032.genreenricher.service;

import com.lux032.genreenricher.config.EnricherConfig;
import com.lux032.genreenricher.model.TrackTags;
import lombok.extern.slf4j.Slf4j;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.exceptions.CannotReadException;
import org.jaudiotagger.audio.exceptions.CannotWriteException;
import org.jaudiotagger.audio.exceptions.InvalidAudioFrameException;
import org.jaudiotagger.audio.exceptions.ReadOnlyFileException;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.TagException;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.List;

/**
 * 音乐标签读写服务
 * 使用 JAudioTagger 读取艺术家/标题, 写入流派、年份和专辑
 */
@Slf4j
public class TagWriterService {

    public static final String GENRE_SEPARATOR = ";";

    private final EnricherConfig config;

    public TagWriterService(EnricherConfig config) {
        this.config = config;
    }

    /**
     * 读取现有标签
     * @return 文件没有标签时返回所有字段为空的 TrackTags
     * @throws IOException 文件不可读或不是有效的音频文件
     */
    public TrackTags readTags(File audioFile) throws IOException {
        try {
            AudioFile audioFileObj = AudioFileIO.read(audioFile);
            Tag tag = audioFileObj.getTag();

            TrackTags tags = new TrackTags();
            if (tag == null) {
                return tags;
            }
            tags.setArtist(emptyToNull(tag.getFirst(FieldKey.ARTIST)));
            tags.setTitle(emptyToNull(tag.getFirst(FieldKey.TITLE)));
            tags.setAlbum(emptyToNull(tag.getFirst(FieldKey.ALBUM)));
            tags.setYear(emptyToNull(tag.getFirst(FieldKey.YEAR)));
            tags.setGenre(emptyToNull(tag.getFirst(FieldKey.GENRE)));
            return tags;

        } catch (CannotReadException | TagException | ReadOnlyFileException | InvalidAudioFrameException e) {
            throw new IOException("Failed to read tags from " + audioFile.getName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * 写入标签
     * @param genres 最终流派, 以分号连接写入
     * @param year 为 null 时不修改
     * @param album 为 null 时不修改
     */
    public void writeTags(File audioFile, List<String> genres, String year, String album) throws IOException {
        if (!audioFile.exists()) {
            throw new IOException("File does not exist: " + audioFile.getAbsolutePath());
        }
        if (config.isCreateBackup()) {
            createBackup(audioFile);
        }

        try {
            AudioFile audioFileObj = AudioFileIO.read(audioFile);
            Tag tag = audioFileObj.getTagOrCreateAndSetDefault();

            if (genres != null && !genres.isEmpty()) {
                tag.setField(FieldKey.GENRE, String.join(GENRE_SEPARATOR, genres));
            }
            if (year != null) {
                tag.setField(FieldKey.YEAR, year);
            }
            if (album != null) {
                tag.setField(FieldKey.ALBUM, album);
            }

            audioFileObj.commit();
            log.info("Tags written to {}: genres={}, year={}, album={}", audioFile.getName(), genres, year, album);

        } catch (CannotReadException | TagException | ReadOnlyFileException | InvalidAudioFrameException
                 | CannotWriteException e) {
            throw new IOException("Failed to write tags to " + audioFile.getName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * 创建备份文件, 未配置备份目录时放在源文件同目录
     */
    Path createBackup(File originalFile) throws IOException {
        String timestamp = new SimpleDateFormat("yyyyMMdd_HHmmss").format(new Date());
        String backupFileName = originalFile.getName() + ".backup_" + timestamp;

        Path backupDir = config.getBackupDirectory() != null
            ? Paths.get(config.getBackupDirectory())
            : originalFile.getAbsoluteFile().toPath().getParent();
        Files.createDirectories(backupDir);

        Path backupFile = backupDir.resolve(backupFileName);
        Files.copy(originalFile.toPath(), backupFile, StandardCopyOption.REPLACE_EXISTING);
        log.info("Backup created: {}", backupFile);
        return backupFile;
    }

    private static String emptyToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }
}
