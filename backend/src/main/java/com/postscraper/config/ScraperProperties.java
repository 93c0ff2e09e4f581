package com.postscraper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private int parallelWorkers = 5;
    private int maxConcurrency = 16;
    private int maxRetry = 5;
    private int retryWaitSeconds = 10;
    private String outputDir = "output";
    private Tool tool = new Tool();
    private Auth auth = new Auth();
    private Cli cli = new Cli();

    public int getParallelWorkers() {
        return Math.max(1, Math.min(parallelWorkers, getMaxConcurrency()));
    }

    public void setParallelWorkers(int parallelWorkers) {
        this.parallelWorkers = Math.max(1, parallelWorkers);
    }

    public int getMaxConcurrency() {
        return Math.max(1, maxConcurrency);
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = Math.max(1, maxConcurrency);
    }

    public int getMaxRetry() {
        return Math.max(1, maxRetry);
    }

    public void setMaxRetry(int maxRetry) {
        this.maxRetry = Math.max(1, maxRetry);
    }

    public int getRetryWaitSeconds() {
        return Math.max(0, retryWaitSeconds);
    }

    public void setRetryWaitSeconds(int retryWaitSeconds) {
        this.retryWaitSeconds = Math.max(0, retryWaitSeconds);
    }

    public String getOutputDir() {
        return outputDir == null || outputDir.isBlank() ? "output" : outputDir.trim();
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public Tool getTool() {
        return tool;
    }

    public void setTool(Tool tool) {
        this.tool = tool;
    }

    public Auth getAuth() {
        return auth;
    }

    public void setAuth(Auth auth) {
        this.auth = auth;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static class Tool {
        private String executable = "bird";
        private String refreshCommand = "query-ids";
        private int fetchTimeoutSeconds = 60;
        private int refreshTimeoutSeconds = 120;
        private int versionTimeoutSeconds = 10;
        private int whoamiTimeoutSeconds = 30;

        public String getExecutable() {
            return executable == null || executable.isBlank() ? "bird" : executable.trim();
        }

        public void setExecutable(String executable) {
            this.executable = executable;
        }

        public String getRefreshCommand() {
            return refreshCommand == null || refreshCommand.isBlank() ? "query-ids" : refreshCommand.trim();
        }

        public void setRefreshCommand(String refreshCommand) {
            this.refreshCommand = refreshCommand;
        }

        public int getFetchTimeoutSeconds() {
            return Math.max(1, fetchTimeoutSeconds);
        }

        public void setFetchTimeoutSeconds(int fetchTimeoutSeconds) {
            this.fetchTimeoutSeconds = Math.max(1, fetchTimeoutSeconds);
        }

        public int getRefreshTimeoutSeconds() {
            return Math.max(1, refreshTimeoutSeconds);
        }

        public void setRefreshTimeoutSeconds(int refreshTimeoutSeconds) {
            this.refreshTimeoutSeconds = Math.max(1, refreshTimeoutSeconds);
        }

        public int getVersionTimeoutSeconds() {
            return Math.max(1, versionTimeoutSeconds);
        }

        public void setVersionTimeoutSeconds(int versionTimeoutSeconds) {
            this.versionTimeoutSeconds = Math.max(1, versionTimeoutSeconds);
        }

        public int getWhoamiTimeoutSeconds() {
            return Math.max(1, whoamiTimeoutSeconds);
        }

        public void setWhoamiTimeoutSeconds(int whoamiTimeoutSeconds) {
            this.whoamiTimeoutSeconds = Math.max(1, whoamiTimeoutSeconds);
        }
    }

    public static class Auth {
        private String authToken;
        private String ct0;
        private String proxyUrl;
        private String cookieFile;

        public String getAuthToken() {
            return blankToNull(authToken);
        }

        public void setAuthToken(String authToken) {
            this.authToken = authToken;
        }

        public String getCt0() {
            return blankToNull(ct0);
        }

        public void setCt0(String ct0) {
            this.ct0 = ct0;
        }

        public String getProxyUrl() {
            return blankToNull(proxyUrl);
        }

        public void setProxyUrl(String proxyUrl) {
            this.proxyUrl = proxyUrl;
        }

        public String getCookieFile() {
            if (cookieFile == null || cookieFile.isBlank()) {
                return System.getProperty("user.home") + "/.config/x-scraper/cookies.json";
            }
            return cookieFile.trim();
        }

        public void setCookieFile(String cookieFile) {
            this.cookieFile = cookieFile;
        }
    }

    public static class Cli {
        private boolean run;
        private String urls = "";
        private String format = "json";
        private String output;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getUrls() {
            return urls;
        }

        public void setUrls(String urls) {
            this.urls = urls;
        }

        public String getFormat() {
            return format;
        }

        public void setFormat(String format) {
            this.format = format;
        }

        public String getOutput() {
            return blankToNull(output);
        }

        public void setOutput(String output) {
            this.output = output;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    private static String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
