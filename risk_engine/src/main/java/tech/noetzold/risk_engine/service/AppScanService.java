package tech.noetzold.risk_engine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import tech.noetzold.risk_engine.catalog.AppCategoryDetector;
import tech.noetzold.risk_engine.model.*;
import tech.noetzold.risk_engine.repository.BaselineRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs the whole per-package pipeline: trust, category, baseline drift, findings, verdict, baseline
 * update, events, feature vector, install timeline and incidents.
 *
 * <p>The read-compare-write cycle on a package's baseline is serialized per package. Different
 * packages never wait on each other.</p>
 */
@Slf4j
@Service
public class AppScanService {

    static final Duration RECENT_EVENTS_WINDOW = Duration.ofHours(48);

    private final TrustEvidenceEngine trustEngine;
    private final AppCategoryDetector categoryDetector;
    private final BaselineManager baselineManager;
    private final FindingCollector findingCollector;
    private final TrustRiskModel riskModel;
    private final EventRecorder eventRecorder;
    private final FeatureVectorBuilder featureVectorBuilder;
    private final InstallTimelineAnalyzer timelineAnalyzer;
    private final RootCauseResolver rootCauseResolver;
    private final IncidentService incidentService;
    private final BaselineRepository baselineRepository;
    private final Executor scanExecutor;
    private final Clock clock;

    private final Map<String, ReentrantLock> packageLocks = new ConcurrentHashMap<>();

    public AppScanService(TrustEvidenceEngine trustEngine,
                          AppCategoryDetector categoryDetector,
                          BaselineManager baselineManager,
                          FindingCollector findingCollector,
                          TrustRiskModel riskModel,
                          EventRecorder eventRecorder,
                          FeatureVectorBuilder featureVectorBuilder,
                          InstallTimelineAnalyzer timelineAnalyzer,
                          RootCauseResolver rootCauseResolver,
                          IncidentService incidentService,
                          BaselineRepository baselineRepository,
                          @Qualifier("scanExecutor") Executor scanExecutor,
                          Clock clock) {
        this.trustEngine = trustEngine;
        this.categoryDetector = categoryDetector;
        this.baselineManager = baselineManager;
        this.findingCollector = findingCollector;
        this.riskModel = riskModel;
        this.eventRecorder = eventRecorder;
        this.featureVectorBuilder = featureVectorBuilder;
        this.timelineAnalyzer = timelineAnalyzer;
        this.rootCauseResolver = rootCauseResolver;
        this.incidentService = incidentService;
        this.baselineRepository = baselineRepository;
        this.scanExecutor = scanExecutor;
        this.clock = clock;
    }

    public ScanResult scanApp(ScanRequest request) {
        Instant now = clock.instant();
        boolean isFirstScan = baselineRepository.count() == 0;
        return scanApp(request, null, isFirstScan, now);
    }

    /**
     * Scans all packages concurrently. Whether this is the first scan is decided once for the
     * whole batch, before any baseline is written.
     */
    public BatchScanResponse scanBatch(BatchScanRequest request) {
        Instant now = clock.instant();
        boolean isFirstScan = baselineRepository.count() == 0;
        log.info("Batch scan of {} package(s) started (firstScan={})", request.getApps().size(), isFirstScan);

        List<CompletableFuture<ScanResult>> futures = request.getApps().stream()
                .map(r -> CompletableFuture.supplyAsync(
                        () -> scanApp(r, request.getDeviceIntegrity(), isFirstScan, now), scanExecutor))
                .toList();
        List<ScanResult> results = futures.stream().map(CompletableFuture::join).toList();

        List<BaselineComparison> removed = List.of();
        if (request.isReportRemoved()) {
            Set<String> seen = new HashSet<>();
            results.forEach(r -> seen.add(r.packageName()));
            removed = findRemovedApps(seen);
        }

        Map<String, AppCategory> categories = new HashMap<>();
        Map<String, InstallerType> installers = new HashMap<>();
        results.forEach(r -> {
            categories.put(r.packageName(), r.category());
            installers.put(r.packageName(), r.trust().installerType());
        });
        ScanDiagnostics diagnostics = ScanDiagnostics.fromVerdicts(
                results.stream().map(ScanResult::verdict).toList(), categories, installers);

        eventRecorder.pruneExpired(now);
        log.info("Batch scan finished: {} app(s), {} critical, {} need attention, {} removed",
                diagnostics.totalApps(), diagnostics.count(EffectiveRisk.CRITICAL),
                diagnostics.count(EffectiveRisk.NEEDS_ATTENTION), removed.size());

        return new BatchScanResponse(results, removed, diagnostics, diagnostics.appsSecurityScore());
    }

    /**
     * Also forgets the scan lock of every removed package that is not being scanned right now.
     */
    public List<BaselineComparison> findRemovedApps(Set<String> currentPackages) {
        List<BaselineComparison> removed = baselineManager.findRemovedApps(baselineRepository.findAll(), currentPackages);
        removed.forEach(r -> packageLocks.computeIfPresent(r.packageName(),
                (pkg, lock) -> lock.isLocked() || lock.hasQueuedThreads() ? lock : null));
        return removed;
    }

    int trackedPackageCount() {
        return packageLocks.size();
    }

    public BaselineRecord findBaseline(String packageName) {
        return baselineRepository.findByPackageName(packageName)
                .orElseThrow(() -> new NoSuchElementException("No baseline for package: " + packageName));
    }

    ScanResult scanApp(ScanRequest request, DeviceIntegrityEvidence batchIntegrity, boolean isFirstScan, Instant now) {
        ScannedAppEvidence app = request.getApp();
        String packageName = app.getPackageName();
        DeviceIntegrityEvidence integrity = request.getDeviceIntegrity() != null
                ? request.getDeviceIntegrity()
                : batchIntegrity;

        ReentrantLock lock = packageLocks.computeIfAbsent(packageName, k -> new ReentrantLock());
        lock.lock();
        try {
            TrustEvidence trust = trustEngine.collectEvidence(app, integrity);
            AppCategory category = categoryDetector.detect(packageName, app.getAppName(), app.requestedOrEmpty());

            BaselineRecord stored = baselineRepository.findByPackageName(packageName).orElse(null);
            BaselineComparison comparison = baselineManager.compareWithBaseline(app, stored, isFirstScan);

            SpecialAccessSnapshot snapshot = request.getSpecialAccess();
            Set<CapabilityCluster> active = riskModel.activeClusters(app.grantedOrEmpty(), snapshot);
            List<RawFinding> findings = new ArrayList<>(findingCollector.staticFindings(app, trust, category, active));
            findings.addAll(findingCollector.baselineFindings(comparison, trust, app.isSystemApp()));

            boolean isNewApp = comparison.status() == BaselineStatus.NEW && !comparison.isFirstScan();
            EvaluationContext context = EvaluationContext.builder()
                    .packageName(packageName)
                    .trustEvidence(trust)
                    .rawFindings(findings)
                    .grantedPermissions(app.grantedOrEmpty())
                    .category(category)
                    .isSystemApp(app.isSystemApp())
                    .isNewApp(isNewApp)
                    .specialAccessSnapshot(snapshot)
                    .installClass(riskModel.classifyInstall(app.isSystemApp(), trust.installerType(),
                            app.resolvedPartition()))
                    .build();
            AppVerdict verdict = riskModel.evaluate(context);

            baselineRepository.save(baselineManager.updateBaseline(app, stored, now));

            List<SecurityEvent> events = new ArrayList<>(eventRecorder.recordBaselineAnomalies(comparison, now));
            events.addAll(eventRecorder.recordCombos(verdict, now));
            eventRecorder.recordScannerFindings(verdict, now).ifPresent(events::add);
            eventRecorder.recordSpecialAccess(snapshot, now).ifPresent(events::add);

            AppFeatureVector features = featureVectorBuilder.build(app, trust, comparison, verdict, category, snapshot, now);
            List<SecurityEvent> recent = eventRecorder.recentEvents(now, RECENT_EVENTS_WINDOW);
            TimelineResult timeline = timelineAnalyzer.analyze(features, recent, now);
            if (timeline.isDropperCandidate()) {
                events.add(eventRecorder.recordTimeline(timeline, now));
            }

            List<SecurityIncident> incidents = List.of();
            if (shouldEscalate(verdict, timeline) && !events.isEmpty()) {
                Set<String> ownIds = new HashSet<>();
                events.forEach(e -> ownIds.add(e.id()));
                List<SecurityEvent> others = recent.stream().filter(e -> !ownIds.contains(e.id())).toList();
                incidents = events.stream()
                        .map(eventRecorder::promote)
                        .map(e -> rootCauseResolver.resolve(e, features, null, others))
                        .map(incidentService::record)
                        .toList();
            }

            log.debug("Scanned {}: {} (baseline={}, events={}, incidents={}, monitor={})",
                    packageName, verdict.effectiveRisk(), comparison.status(), events.size(), incidents.size(),
                    features.shouldMonitor());
            return new ScanResult(packageName, category, trust, comparison, verdict, features, timeline, incidents);
        } finally {
            lock.unlock();
        }
    }

    private static boolean shouldEscalate(AppVerdict verdict, TimelineResult timeline) {
        return verdict.effectiveRisk() == EffectiveRisk.CRITICAL
                || verdict.effectiveRisk() == EffectiveRisk.NEEDS_ATTENTION
                || timeline.isDropperCandidate();
    }
}
