package com.behaviorguard.detector.detection;

import com.behaviorguard.detector.config.HeuristicsConfig;
import com.behaviorguard.detector.event.BehaviorEvent;
import com.behaviorguard.detector.event.ImagePaths;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.behaviorguard.detector.event.BehaviorEvent.*;

/**
 * Hand-authored indicators evaluated against single events and against the
 * ordered token buffer of a process.
 *
 * <p>
 * Event rules:
 * </p>
 * <ul>
 * <li><b>Injection:</b> any remote thread creation (T1055)</li>
 * <li><b>Critical-process access:</b> handle opened on lsass/winlogon/csrss (T1003)</li>
 * <li><b>AI/C2 communication:</b> connection or DNS lookup to a configured
 * generative-AI or tunnelling domain (T1071)</li>
 * <li><b>Persistence:</b> registry write under an autorun key (T1547)</li>
 * <li><b>Suspicious file drop:</b> executable-like file created, more when it
 * lands in a temp or public-writable directory</li>
 * <li><b>Process tampering:</b> image replaced after start (T1055.012)</li>
 * </ul>
 *
 * <p>
 * Sequence rules match an ordered subsequence of tokens:
 * </p>
 * <ul>
 * <li><b>Injection chain:</b> VirtualAlloc -> WriteProcessMemory -> CreateRemoteThread</li>
 * <li><b>Credential access:</b> OpenProcess:lsass.exe -> ReadProcessMemory</li>
 * <li><b>Dropper:</b> connect -> CreateFile:.exe -> CreateProcess</li>
 * </ul>
 *
 * <p>
 * The engine only computes hits. Applying deltas is the store's job.
 * </p>
 */
@Component
public class HeuristicEngine {

    private final HeuristicsConfig config;
    private final List<TokenSequence> sequences;

    public HeuristicEngine(HeuristicsConfig config) {
        this.config = config;
        HeuristicsConfig.Deltas deltas = config.getDeltas();
        this.sequences = List.of(
                new TokenSequence(Indicator.INJECTION_CHAIN, deltas.getInjectionChain(),
                        List.of("virtualalloc", "writeprocessmemory", "createremotethread"),
                        "Injection chain: VirtualAlloc -> WriteProcessMemory -> CreateRemoteThread"),
                new TokenSequence(Indicator.CREDENTIAL_ACCESS, deltas.getCredentialAccess(),
                        List.of("openprocess:lsass.exe", "readprocessmemory"),
                        "Credential access: OpenProcess(lsass) -> ReadProcessMemory"),
                new TokenSequence(Indicator.DROPPER_CHAIN, deltas.getDropperChain(),
                        List.of("connect", "createfile:.exe", "createprocess"),
                        "Dropper: connect -> CreateFile(.exe) -> CreateProcess"));
    }

    /**
     * Evaluate a single event.
     *
     * @return all raised hits, possibly empty, never null
     */
    public List<IndicatorHit> evaluate(BehaviorEvent event) {
        HeuristicsConfig.Deltas deltas = config.getDeltas();
        List<IndicatorHit> hits = new ArrayList<>(2);

        switch (event.kind()) {
            case REMOTE_THREAD_CREATE -> hits.add(new IndicatorHit(Indicator.INJECTION, deltas.getInjection(),
                    String.format("Remote thread created in pid=%s (%s)",
                            event.attribute(TARGET_PROCESS_ID), event.attribute(TARGET_IMAGE))));
            case PROCESS_ACCESS -> {
                String target = event.attribute(TARGET_IMAGE);
                if (config.isCriticalProcess(target)) {
                    hits.add(new IndicatorHit(Indicator.CRITICAL_PROCESS_ACCESS,
                            deltas.getCriticalProcessAccess(),
                            String.format("Access to critical process %s (access=%s)",
                                    ImagePaths.fileName(target), event.attribute(GRANTED_ACCESS))));
                }
            }
            case NETWORK_CONNECT -> {
                String keyword = config.matchAiKeyword(event.attribute(DESTINATION_HOSTNAME));
                if (keyword == null) {
                    keyword = config.matchAiKeyword(event.attribute(DESTINATION_IP));
                }
                if (keyword != null) {
                    hits.add(aiHit(keyword, event.attribute(DESTINATION_HOSTNAME).isEmpty()
                            ? event.attribute(DESTINATION_IP)
                            : event.attribute(DESTINATION_HOSTNAME)));
                }
            }
            case DNS_QUERY -> {
                String query = event.attribute(QUERY_NAME);
                String keyword = config.matchAiKeyword(query);
                if (keyword != null) {
                    hits.add(aiHit(keyword, query));
                }
            }
            case REGISTRY_WRITE -> {
                String key = event.attribute(TARGET_OBJECT);
                if (config.isAutorunKey(key)) {
                    hits.add(new IndicatorHit(Indicator.PERSISTENCE, deltas.getPersistence(),
                            "Autorun registry write: " + key));
                }
            }
            case FILE_CREATE -> {
                String target = event.attribute(TARGET_FILENAME);
                boolean executable = config.hasSuspiciousExtension(target);
                boolean writableDir = config.inSuspiciousDirectory(target);
                if (executable && writableDir) {
                    hits.add(new IndicatorHit(Indicator.SUSPICIOUS_FILE_DROP,
                            deltas.getFileDropInWritableDirectory(),
                            "Executable dropped in writable directory: " + target));
                } else if (executable || writableDir) {
                    hits.add(new IndicatorHit(Indicator.SUSPICIOUS_FILE_DROP, deltas.getFileDrop(),
                            "Suspicious file created: " + target));
                }
            }
            case PROCESS_TAMPERING -> hits.add(new IndicatorHit(Indicator.PROCESS_TAMPERING,
                    deltas.getProcessTampering(),
                    String.format("Process image tampering (%s) on %s",
                            event.attribute(TAMPER_TYPE), event.image())));
            case PROCESS_CREATE, IMAGE_LOAD, OTHER -> {
                // no single-event indicator
            }
        }
        return hits;
    }

    private IndicatorHit aiHit(String keyword, String destination) {
        return new IndicatorHit(Indicator.AI_COMMUNICATION, config.getDeltas().getAiCommunication(),
                String.format("Communication with AI/C2 endpoint %s (matched '%s')", destination, keyword));
    }

    /**
     * Match the ordered token buffer against the known sequences.
     *
     * @param tokens buffered tokens, oldest first
     * @return hits for every sequence found, possibly empty
     */
    public List<IndicatorHit> evaluateSequence(List<String> tokens) {
        List<IndicatorHit> hits = new ArrayList<>(1);
        if (tokens == null || tokens.isEmpty()) {
            return hits;
        }
        for (TokenSequence sequence : sequences) {
            if (matchesSequence(tokens, sequence.pattern())) {
                hits.add(new IndicatorHit(sequence.indicator(), sequence.delta(), sequence.description()));
            }
        }
        return hits;
    }

    /**
     * Subsequence match: pattern elements must appear in order, not necessarily
     * adjacent. A pattern element matches a token equal to it or a token that
     * starts with it followed by ':' ({@code connect} matches
     * {@code connect:1.2.3.4:443}).
     */
    private static boolean matchesSequence(List<String> tokens, List<String> pattern) {
        if (tokens.size() < pattern.size()) {
            return false;
        }
        int patternIdx = 0;
        for (String token : tokens) {
            String lower = token.toLowerCase(Locale.ROOT);
            String expected = pattern.get(patternIdx);
            if (lower.equals(expected) || lower.startsWith(expected + ":")) {
                patternIdx++;
                if (patternIdx == pattern.size()) {
                    return true;
                }
            }
        }
        return false;
    }

    private record TokenSequence(Indicator indicator, int delta, List<String> pattern, String description) {
    }
}
