package com.dedicatedcode.kentta;

import com.dedicatedcode.kentta.config.KenttaConfiguration;
import com.dedicatedcode.kentta.service.importer.ImportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KenttaApplication implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(KenttaApplication.class);

    @Autowired
    private ImportService importService;

    @Autowired
    private KenttaConfiguration config;

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(KenttaApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    private void printUsage() {
        logger.info("KENTTA imports X-Plane apt.dat scenery into an airport database.");
        logger.info("Usage:");
        logger.info("  --import --scenery-path <apt.dat file or scenery directory> [--data-dir <directory>]");
        logger.info("");
        logger.info("Sample:");
        logger.info("  java -jar kentta.jar --import --scenery-path '/opt/X-Plane 12/Global Scenery' --data-dir ./data");
    }

    @Override
    public void run(String... args) throws Exception {
        boolean isImportMode = false;
        String sceneryPath = null;
        String dataDir = config.getDataDir();

        for (int i = 0; i < args.length; i++) {
            if ("--import".equals(args[i])) {
                isImportMode = true;
            } else if ("--scenery-path".equals(args[i]) && i + 1 < args.length) {
                sceneryPath = args[i + 1];
            } else if ("--data-dir".equals(args[i]) && i + 1 < args.length) {
                dataDir = args[i + 1];
            }
        }

        if (!isImportMode) {
            printUsage();
            return;
        }
        if (sceneryPath == null) {
            logger.error("Import mode requires --scenery-path argument");
            System.exit(1);
        }

        Runtime.getRuntime().addShutdownHook(new Thread(importService::cancel));
        try {
            importService.importData(sceneryPath, dataDir);
            System.exit(0);
        } catch (Exception e) {
            logger.error("Import failed", e);
            System.exit(1);
        }
    }
}
