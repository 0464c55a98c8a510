package com.behaviorguard.detector.detection;

import com.behaviorguard.detector.config.HeuristicsConfig;
import com.behaviorguard.detector.event.BehaviorEvent;
import com.behaviorguard.detector.event.EventKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.behaviorguard.detector.event.BehaviorEvent.*;
import static org.junit.jupiter.api.Assertions.*;

class HeuristicEngineTest {

    private HeuristicEngine engine;

    @BeforeEach
    void setUp() {
        engine = new HeuristicEngine(new HeuristicsConfig());
    }

    @Test
    void shouldFlagRemoteThreadAsInjection() {
        List<IndicatorHit> hits = engine.evaluate(event(EventKind.REMOTE_THREAD_CREATE,
                Map.of(TARGET_PROCESS_ID, "900", TARGET_IMAGE, "C:\\Windows\\explorer.exe")));

        assertEquals(1, hits.size());
        assertEquals(Indicator.INJECTION, hits.get(0).indicator());
        assertEquals(50, hits.get(0).delta());
        assertTrue(hits.get(0).immediate());
    }

    @Test
    void shouldFlagOnlyCriticalProcessAccess() {
        List<IndicatorHit> lsass = engine.evaluate(event(EventKind.PROCESS_ACCESS,
                Map.of(TARGET_IMAGE, "C:\\Windows\\System32\\LSASS.EXE", GRANTED_ACCESS, "0x1010")));
        assertEquals(Indicator.CRITICAL_PROCESS_ACCESS, lsass.get(0).indicator());
        assertEquals(30, lsass.get(0).delta());

        assertTrue(engine.evaluate(event(EventKind.PROCESS_ACCESS,
                Map.of(TARGET_IMAGE, "C:\\Windows\\notepad.exe"))).isEmpty());
    }

    @Test
    void shouldFlagAiEndpointsByHostnameIpOrDnsQuery() {
        List<IndicatorHit> byHost = engine.evaluate(event(EventKind.NETWORK_CONNECT,
                Map.of(DESTINATION_HOSTNAME, "api.OpenAI.com", DESTINATION_IP, "104.18.1.1")));
        assertEquals(Indicator.AI_COMMUNICATION, byHost.get(0).indicator());
        assertEquals(60, byHost.get(0).delta());

        List<IndicatorHit> byIp = engine.evaluate(event(EventKind.NETWORK_CONNECT,
                Map.of(DESTINATION_IP, "abc.ngrok.io")));
        assertEquals(1, byIp.size());

        List<IndicatorHit> dns = engine.evaluate(event(EventKind.DNS_QUERY,
                Map.of(QUERY_NAME, "huggingface.co")));
        assertEquals(Indicator.AI_COMMUNICATION, dns.get(0).indicator());

        assertTrue(engine.evaluate(event(EventKind.NETWORK_CONNECT,
                Map.of(DESTINATION_HOSTNAME, "example.org"))).isEmpty());
    }

    @Test
    void shouldFlagAutorunRegistryWrites() {
        List<IndicatorHit> hits = engine.evaluate(event(EventKind.REGISTRY_WRITE,
                Map.of(TARGET_OBJECT, "HKLM\\Software\\Microsoft\\Windows\\CurrentVersion\\Run\\updater")));
        assertEquals(Indicator.PERSISTENCE, hits.get(0).indicator());
        assertEquals(25, hits.get(0).delta());

        assertTrue(engine.evaluate(event(EventKind.REGISTRY_WRITE,
                Map.of(TARGET_OBJECT, "HKCU\\Software\\Vendor\\Settings"))).isEmpty());
    }

    @Test
    void shouldWeighFileDropsByExtensionAndDirectory() {
        List<IndicatorHit> both = engine.evaluate(event(EventKind.FILE_CREATE,
                Map.of(TARGET_FILENAME, "C:\\Users\\bob\\AppData\\Local\\Temp\\payload.exe")));
        assertEquals(20, both.get(0).delta());

        List<IndicatorHit> extensionOnly = engine.evaluate(event(EventKind.FILE_CREATE,
                Map.of(TARGET_FILENAME, "D:\\tools\\setup.exe")));
        assertEquals(15, extensionOnly.get(0).delta());

        List<IndicatorHit> directoryOnly = engine.evaluate(event(EventKind.FILE_CREATE,
                Map.of(TARGET_FILENAME, "C:\\Windows\\Temp\\report.txt")));
        assertEquals(15, directoryOnly.get(0).delta());

        assertTrue(engine.evaluate(event(EventKind.FILE_CREATE,
                Map.of(TARGET_FILENAME, "D:\\docs\\notes.txt"))).isEmpty());
    }

    @Test
    void shouldFlagProcessTampering() {
        List<IndicatorHit> hits = engine.evaluate(event(EventKind.PROCESS_TAMPERING,
                Map.of(TAMPER_TYPE, "Image is replaced")));
        assertEquals(Indicator.PROCESS_TAMPERING, hits.get(0).indicator());
    }

    @Test
    void shouldRaiseNothingForPlainEvents() {
        assertTrue(engine.evaluate(event(EventKind.PROCESS_CREATE, Map.of())).isEmpty());
        assertTrue(engine.evaluate(event(EventKind.IMAGE_LOAD,
                Map.of(IMAGE_LOADED, "C:\\Windows\\System32\\ntdll.dll"))).isEmpty());
        assertTrue(engine.evaluate(event(EventKind.OTHER, Map.of())).isEmpty());
    }

    @Test
    void shouldMatchInjectionChainAsOrderedSubsequence() {
        List<IndicatorHit> hits = engine.evaluateSequence(List.of(
                "VirtualAlloc", "CreateFile", "WriteProcessMemory", "CloseHandle", "CreateRemoteThread"));

        assertEquals(1, hits.size());
        assertEquals(Indicator.INJECTION_CHAIN, hits.get(0).indicator());
        assertEquals(50, hits.get(0).delta());
    }

    @Test
    void shouldNotMatchOutOfOrderSequence() {
        assertTrue(engine.evaluateSequence(List.of(
                "CreateRemoteThread", "WriteProcessMemory", "VirtualAlloc")).isEmpty());
        assertTrue(engine.evaluateSequence(List.of()).isEmpty());
        assertTrue(engine.evaluateSequence(null).isEmpty());
    }

    @Test
    void shouldMatchPrefixedTokens() {
        List<IndicatorHit> dropper = engine.evaluateSequence(List.of(
                "DnsQuery:cdn.example", "connect:10.0.0.5:443", "CreateFile:.exe", "CreateProcess"));
        assertEquals(List.of(Indicator.DROPPER_CHAIN), dropper.stream().map(IndicatorHit::indicator).toList());

        List<IndicatorHit> credentials = engine.evaluateSequence(List.of(
                "OpenProcess:lsass.exe", "ReadProcessMemory"));
        assertEquals(Indicator.CREDENTIAL_ACCESS, credentials.get(0).indicator());

        assertTrue(engine.evaluateSequence(List.of("OpenProcess", "ReadProcessMemory")).isEmpty());
    }

    private static BehaviorEvent event(EventKind kind, Map<String, String> attributes) {
        return new BehaviorEvent(42, kind, 1, attributes, Instant.now());
    }
}
