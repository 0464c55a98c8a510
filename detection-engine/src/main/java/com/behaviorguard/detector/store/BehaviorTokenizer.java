package com.behaviorguard.detector.store;

import com.behaviorguard.detector.config.HeuristicsConfig;
import com.behaviorguard.detector.event.BehaviorEvent;
import com.behaviorguard.detector.event.ImagePaths;
import org.springframework.stereotype.Component;

import java.util.Locale;

import static com.behaviorguard.detector.event.BehaviorEvent.*;

/**
 * Derives the canonical behavior token for an event, in the vocabulary the
 * classifier was trained on ({@code CreateProcess}, {@code LoadLibrary:ntdll.dll},
 * {@code connect:10.0.0.5:443}, ...).
 */
@Component
public class BehaviorTokenizer {

    private final HeuristicsConfig heuristics;

    public BehaviorTokenizer(HeuristicsConfig heuristics) {
        this.heuristics = heuristics;
    }

    public String tokenFor(BehaviorEvent event) {
        return switch (event.kind()) {
            case PROCESS_CREATE -> "CreateProcess";
            case NETWORK_CONNECT -> connectToken(event);
            case IMAGE_LOAD -> {
                String dll = ImagePaths.fileName(event.attribute(IMAGE_LOADED));
                yield "LoadLibrary:" + (dll.isEmpty() ? "unknown" : dll.toLowerCase(Locale.ROOT));
            }
            case REMOTE_THREAD_CREATE -> "CreateRemoteThread";
            case PROCESS_ACCESS -> {
                String target = event.attribute(TARGET_IMAGE);
                yield heuristics.isCriticalProcess(target)
                        ? "OpenProcess:" + ImagePaths.fileName(target).toLowerCase(Locale.ROOT)
                        : "OpenProcess";
            }
            case FILE_CREATE -> {
                String target = event.attribute(TARGET_FILENAME);
                yield heuristics.hasSuspiciousExtension(target)
                        ? "CreateFile:" + ImagePaths.extension(target)
                        : "CreateFile";
            }
            case REGISTRY_WRITE -> registryToken(event);
            case DNS_QUERY -> {
                String query = event.attribute(QUERY_NAME);
                yield query.isEmpty() ? "DnsQuery" : "DnsQuery:" + query.toLowerCase(Locale.ROOT);
            }
            case PROCESS_TAMPERING -> "ProcessTampering";
            case OTHER -> event.has(OPERATION) ? event.attribute(OPERATION) : "Event:" + event.eventId();
        };
    }

    private static String connectToken(BehaviorEvent event) {
        String destination = event.has(DESTINATION_IP)
                ? event.attribute(DESTINATION_IP)
                : event.attribute(DESTINATION_HOSTNAME);
        if (destination.isEmpty()) {
            return "connect";
        }
        String port = event.attribute(DESTINATION_PORT);
        return port.isEmpty() ? "connect:" + destination : "connect:" + destination + ":" + port;
    }

    private static String registryToken(BehaviorEvent event) {
        if (event.eventId() == 13) {
            return "RegSetValue";
        }
        if (event.eventId() == 14) {
            return "RegRenameKey";
        }
        return event.attribute(REGISTRY_EVENT_TYPE).toLowerCase(Locale.ROOT).contains("delete")
                ? "RegDeleteKey"
                : "RegCreateKey";
    }
}
