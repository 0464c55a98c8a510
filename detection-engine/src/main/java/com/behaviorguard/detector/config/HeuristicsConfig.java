package com.behaviorguard.detector.config;

import com.behaviorguard.detector.event.ImagePaths;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Heuristic indicator configuration: trusted images, sensitive targets and the
 * score delta each indicator contributes.
 *
 * <p>
 * All name and path matching is case-insensitive. Image lists hold bare file
 * names ({@code lsass.exe}), directory lists hold path fragments
 * ({@code \temp\}).
 * </p>
 */
@Configuration
@ConfigurationProperties(prefix = "behaviorguard.heuristics")
@Validated
public class HeuristicsConfig {

    private List<String> whitelist = new ArrayList<>(List.of(
            "system", "svchost.exe", "smss.exe", "csrss.exe", "wininit.exe", "services.exe"));

    private List<String> criticalProcesses = new ArrayList<>(List.of(
            "lsass.exe", "winlogon.exe", "csrss.exe"));

    private List<String> suspiciousExtensions = new ArrayList<>(List.of(
            ".exe", ".dll", ".scr", ".bat", ".ps1", ".vbs"));

    private List<String> suspiciousDirectories = new ArrayList<>(List.of(
            "\\temp\\", "\\tmp\\", "\\users\\public\\", "\\appdata\\local\\temp\\",
            "\\programdata\\", "\\windows\\temp\\"));

    private List<String> autorunKeys = new ArrayList<>(List.of(
            "\\currentversion\\run", "\\currentversion\\runonce",
            "\\currentversion\\winlogon", "\\currentcontrolset\\services\\",
            "\\image file execution options\\"));

    private List<String> aiKeywords = new ArrayList<>(List.of(
            "openai", "anthropic", "generativelanguage.googleapis.com", "huggingface.co",
            "api.cohere", "api.mistral.ai", "replicate.com", "ngrok"));

    private Deltas deltas = new Deltas();

    public boolean isWhitelisted(String image) {
        return containsName(whitelist, ImagePaths.fileName(image));
    }

    public boolean isCriticalProcess(String image) {
        return containsName(criticalProcesses, ImagePaths.fileName(image));
    }

    public boolean hasSuspiciousExtension(String path) {
        String lower = lower(path);
        return !lower.isEmpty() && suspiciousExtensions.stream().anyMatch(ext -> lower.endsWith(lower(ext)));
    }

    public boolean inSuspiciousDirectory(String path) {
        String lower = lower(path);
        return !lower.isEmpty() && suspiciousDirectories.stream().anyMatch(dir -> lower.contains(lower(dir)));
    }

    public boolean isAutorunKey(String registryPath) {
        String lower = lower(registryPath);
        return !lower.isEmpty() && autorunKeys.stream().anyMatch(key -> lower.contains(lower(key)));
    }

    /** Returns the first configured AI/C2 keyword contained in the destination, or null. */
    public String matchAiKeyword(String destination) {
        String lower = lower(destination);
        if (lower.isEmpty()) {
            return null;
        }
        for (String keyword : aiKeywords) {
            if (lower.contains(lower(keyword))) {
                return keyword;
            }
        }
        return null;
    }

    private static boolean containsName(List<String> names, String name) {
        if (name.isEmpty()) {
            return false;
        }
        return names.stream().anyMatch(n -> n.trim().equalsIgnoreCase(name));
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    public List<String> getWhitelist() {
        return whitelist;
    }

    public void setWhitelist(List<String> whitelist) {
        this.whitelist = whitelist;
    }

    public List<String> getCriticalProcesses() {
        return criticalProcesses;
    }

    public void setCriticalProcesses(List<String> criticalProcesses) {
        this.criticalProcesses = criticalProcesses;
    }

    public List<String> getSuspiciousExtensions() {
        return suspiciousExtensions;
    }

    public void setSuspiciousExtensions(List<String> suspiciousExtensions) {
        this.suspiciousExtensions = suspiciousExtensions;
    }

    public List<String> getSuspiciousDirectories() {
        return suspiciousDirectories;
    }

    public void setSuspiciousDirectories(List<String> suspiciousDirectories) {
        this.suspiciousDirectories = suspiciousDirectories;
    }

    public List<String> getAutorunKeys() {
        return autorunKeys;
    }

    public void setAutorunKeys(List<String> autorunKeys) {
        this.autorunKeys = autorunKeys;
    }

    public List<String> getAiKeywords() {
        return aiKeywords;
    }

    public void setAiKeywords(List<String> aiKeywords) {
        this.aiKeywords = aiKeywords;
    }

    public Deltas getDeltas() {
        return deltas;
    }

    public void setDeltas(Deltas deltas) {
        this.deltas = deltas;
    }

    /** Score delta per indicator, each in [0, 100]. */
    public static class Deltas {
        @Min(0)
        @Max(100)
        private int injection = 50;
        @Min(0)
        @Max(100)
        private int criticalProcessAccess = 30;
        @Min(0)
        @Max(100)
        private int aiCommunication = 60;
        @Min(0)
        @Max(100)
        private int persistence = 25;
        @Min(0)
        @Max(100)
        private int fileDrop = 15;
        @Min(0)
        @Max(100)
        private int fileDropInWritableDirectory = 20;
        @Min(0)
        @Max(100)
        private int processTampering = 50;
        @Min(0)
        @Max(100)
        private int injectionChain = 50;
        @Min(0)
        @Max(100)
        private int credentialAccess = 30;
        @Min(0)
        @Max(100)
        private int dropperChain = 20;

        public int getInjection() {
            return injection;
        }

        public void setInjection(int injection) {
            this.injection = injection;
        }

        public int getCriticalProcessAccess() {
            return criticalProcessAccess;
        }

        public void setCriticalProcessAccess(int criticalProcessAccess) {
            this.criticalProcessAccess = criticalProcessAccess;
        }

        public int getAiCommunication() {
            return aiCommunication;
        }

        public void setAiCommunication(int aiCommunication) {
            this.aiCommunication = aiCommunication;
        }

        public int getPersistence() {
            return persistence;
        }

        public void setPersistence(int persistence) {
            this.persistence = persistence;
        }

        public int getFileDrop() {
            return fileDrop;
        }

        public void setFileDrop(int fileDrop) {
            this.fileDrop = fileDrop;
        }

        public int getFileDropInWritableDirectory() {
            return fileDropInWritableDirectory;
        }

        public void setFileDropInWritableDirectory(int fileDropInWritableDirectory) {
            this.fileDropInWritableDirectory = fileDropInWritableDirectory;
        }

        public int getProcessTampering() {
            return processTampering;
        }

        public void setProcessTampering(int processTampering) {
            this.processTampering = processTampering;
        }

        public int getInjectionChain() {
            return injectionChain;
        }

        public void setInjectionChain(int injectionChain) {
            this.injectionChain = injectionChain;
        }

        public int getCredentialAccess() {
            return credentialAccess;
        }

        public void setCredentialAccess(int credentialAccess) {
            this.credentialAccess = credentialAccess;
        }

        public int getDropperChain() {
            return dropperChain;
        }

        public void setDropperChain(int dropperChain) {
            this.dropperChain = dropperChain;
        }
    }
}
