package com.kaspaaio.lifecycle;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "kaspa-aio")
public class AioProperties {

    private Install install = new Install();
    private Backup backup = new Backup();
    private Engine engine = new Engine();

    // -- Install accessors (delegate to nested) --
    public Path getInstallRoot() { return Path.of(install.root).toAbsolutePath().normalize(); }
    public Path getComposePath() { return getInstallRoot().resolve(install.composeFile); }
    public Path getEnvPath() { return getInstallRoot().resolve(install.envFile); }
    public Path getStatePath() { return getInstallRoot().resolve(install.stateFile); }

    // -- Backup accessors --
    public Path getBackupRoot() { return getInstallRoot().resolve(backup.directory); }
    public int getBackupRetention() { return backup.retention; }

    // -- Engine accessors --
    public int getMaxParallel() { return Math.max(1, engine.maxParallel); }
    public Duration getApplyTimeout() { return Duration.ofSeconds(engine.applyTimeoutSeconds); }
    public Duration getImageTimeout() { return Duration.ofSeconds(engine.imageTimeoutSeconds); }
    public int getStopTimeoutSeconds() { return engine.stopTimeoutSeconds; }
    public Duration getStatusCacheTtl() { return Duration.ofMillis(engine.statusCacheTtlMillis); }

    public Install getInstall() { return install; }
    public void setInstall(Install install) { this.install = install; }
    public Backup getBackup() { return backup; }
    public void setBackup(Backup backup) { this.backup = backup; }
    public Engine getEngine() { return engine; }
    public void setEngine(Engine engine) { this.engine = engine; }

    public static class Install {
        private String root = ".";
        private String composeFile = "docker-compose.yml";
        private String envFile = ".env";
        private String stateFile = ".kaspa-aio/installation-state.json";

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
        public String getComposeFile() { return composeFile; }
        public void setComposeFile(String composeFile) { this.composeFile = composeFile; }
        public String getEnvFile() { return envFile; }
        public void setEnvFile(String envFile) { this.envFile = envFile; }
        public String getStateFile() { return stateFile; }
        public void setStateFile(String stateFile) { this.stateFile = stateFile; }
    }

    public static class Backup {
        private String directory = ".kaspa-backups";
        private int retention = 10;

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
        public int getRetention() { return retention; }
        public void setRetention(int retention) { this.retention = retention; }
    }

    public static class Engine {
        private String provider = "docker";
        private String dockerHost;
        private int maxParallel = 4;
        private long applyTimeoutSeconds = 1800;
        private long imageTimeoutSeconds = 1800;
        private int stopTimeoutSeconds = 30;
        private long statusCacheTtlMillis = 3000;

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getDockerHost() { return dockerHost; }
        public void setDockerHost(String dockerHost) { this.dockerHost = dockerHost; }
        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public long getApplyTimeoutSeconds() { return applyTimeoutSeconds; }
        public void setApplyTimeoutSeconds(long applyTimeoutSeconds) { this.applyTimeoutSeconds = applyTimeoutSeconds; }
        public long getImageTimeoutSeconds() { return imageTimeoutSeconds; }
        public void setImageTimeoutSeconds(long imageTimeoutSeconds) { this.imageTimeoutSeconds = imageTimeoutSeconds; }
        public int getStopTimeoutSeconds() { return stopTimeoutSeconds; }
        public void setStopTimeoutSeconds(int stopTimeoutSeconds) { this.stopTimeoutSeconds = stopTimeoutSeconds; }
        public long getStatusCacheTtlMillis() { return statusCacheTtlMillis; }
        public void setStatusCacheTtlMillis(long statusCacheTtlMillis) { this.statusCacheTtlMillis = statusCacheTtlMillis; }
    }
}
