package com.lux032.genreenricher;

import com.lux032.genreenricher.config.EnricherConfig;
import com.lux032.genreenricher.core.ApplicationLifecycleManager;
import com.lux032.genreenricher.model.BatchSummary;
import com.lux032.genreenricher.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * MP3 流派补全工具主程序
 * 用法: Main [--dry-run] <文件或目录>...
 */
@Slf4j
public class Main {

    public static void main(String[] args) {
        try {
            // 1. 加载配置
            EnricherConfig config = EnricherConfig.getInstance();

            // 2. 初始化国际化(必须在其他日志之前)
            I18nUtil.init(config.getLanguage());

            List<String> inputs = new ArrayList<>();
            for (String arg : args) {
                if ("--dry-run".equals(arg)) {
                    config.setDryRun(true);
                } else {
                    inputs.add(arg);
                }
            }
            if (inputs.isEmpty()) {
                System.out.println(I18nUtil.getMessage("main.usage"));
                return;
            }
            if (!config.isValid()) {
                log.error(I18nUtil.getMessage("app.config.invalid"));
                return;
            }

            List<File> files = collectFiles(inputs, config.getSupportedFormats());
            log.info(I18nUtil.getMessage("main.files.found"), files.size());
            if (files.isEmpty()) {
                return;
            }

            // 3. 创建并初始化生命周期管理器
            ApplicationLifecycleManager lifecycleManager = new ApplicationLifecycleManager(config);
            lifecycleManager.initializeServices();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> lifecycleManager.getBatchProcessor().stop()));

            // 4. 批量处理
            BatchSummary summary = lifecycleManager.getBatchProcessor().processFiles(files);
            summary.getFailures().forEach((path, error) ->
                log.warn(I18nUtil.getMessage("main.failed.file"), path, error));
            if (summary.isAborted()) {
                log.error(I18nUtil.getMessage("main.batch.aborted"));
            }

            // 5. 输出指标并关闭
            lifecycleManager.logMetrics();
            lifecycleManager.shutdown();

        } catch (Exception e) {
            log.error(I18nUtil.getMessage("main.error"), e);
        }
    }

    /**
     * 展开参数中的文件和目录, 目录递归查找支持的格式
     */
    static List<File> collectFiles(List<String> inputs, String[] supportedFormats) throws IOException {
        List<File> files = new ArrayList<>();
        for (String input : inputs) {
            Path path = Paths.get(input);
            if (Files.isDirectory(path)) {
                try (Stream<Path> stream = Files.walk(path)) {
                    files.addAll(stream
                        .filter(Files::isRegularFile)
                        .filter(p -> isSupported(p, supportedFormats))
                        .sorted()
                        .map(Path::toFile)
                        .collect(Collectors.toList()));
                }
            } else if (Files.isRegularFile(path) && isSupported(path, supportedFormats)) {
                files.add(path.toFile());
            } else {
                log.warn(I18nUtil.getMessage("main.input.skipped"), input);
            }
        }
        return files;
    }

    private static boolean isSupported(Path path, String[] supportedFormats) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String format : supportedFormats) {
            if (name.endsWith("." + format.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
