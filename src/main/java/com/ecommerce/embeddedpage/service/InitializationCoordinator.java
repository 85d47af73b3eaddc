package com.ecommerce.embeddedpage.service;

import com.ecommerce.embeddedpage.config.PageConfigurationSource;
import com.ecommerce.embeddedpage.exception.ResourceCacheException;
import com.ecommerce.embeddedpage.init.HostLifecycle;
import com.ecommerce.embeddedpage.loader.PackageLoader;
import com.ecommerce.embeddedpage.loader.ResourcePackage;
import com.ecommerce.embeddedpage.model.CacheSnapshot;
import com.ecommerce.embeddedpage.model.ExtractedEntry;
import com.ecommerce.embeddedpage.model.InitializationState;
import com.ecommerce.embeddedpage.model.PackageBinding;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 初始化协调器
 *
 * 每个进程周期只执行一次提取：
 * 1. 重建缓存根目录
 * 2. 读取资源包绑定
 * 3. 逐个加载资源包，枚举页面资源，映射路径，按虚拟路径去重后提取
 * 4. 构建完整索引后一次性发布快照，再把状态置为 READY
 *
 * 并发：READY 后无锁快速返回；否则进入互斥区做 DCL 二次检查
 * 致命错误（资源包加载失败、目录失败、提取失败）时状态回到 UNINITIALIZED，异常抛给调用方，已创建的目录保留到下一次重建
 */
@Slf4j
public class InitializationCoordinator {

    private final CacheDirectory cacheDirectory;
    private final PageConfigurationSource configuration;
    private final PackageLoader packageLoader;
    private final ResourceCatalog resourceCatalog;
    private final PathMapper pathMapper;
    private final ResourceExtractor resourceExtractor;

    // 进程级互斥门
    private final ReentrantLock gate = new ReentrantLock();

    // 已注册 teardown 回调的宿主（按引用去重）
    private final Set<HostLifecycle> registeredLifecycles = Collections.newSetFromMap(new IdentityHashMap<>());

    private final List<InitializationListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicLong completedPasses = new AtomicLong();

    private volatile InitializationState state = InitializationState.UNINITIALIZED;
    private volatile CacheSnapshot snapshot = CacheSnapshot.EMPTY;

    public InitializationCoordinator(CacheDirectory cacheDirectory,
                                     PageConfigurationSource configuration,
                                     PackageLoader packageLoader,
                                     ResourceCatalog resourceCatalog,
                                     PathMapper pathMapper,
                                     ResourceExtractor resourceExtractor) {
        this.cacheDirectory = cacheDirectory;
        this.configuration = configuration;
        this.packageLoader = packageLoader;
        this.resourceCatalog = resourceCatalog;
        this.pathMapper = pathMapper;
        this.resourceExtractor = resourceExtractor;
    }

    public void addListener(InitializationListener listener) {
        listeners.add(listener);
    }

    /**
     * 确保已初始化（无宿主生命周期）
     */
    public CacheSnapshot ensureInitialized() {
        return ensureInitialized(null);
    }

    /**
     * 确保已初始化，可并发重复调用，只有第一次有效调用做实际工作
     * @param hostLifecycle 宿主生命周期，非 null 时注册关闭回调
     * @return 本次调用观察到的就绪快照，根目录非 null
     * @throws ResourceCacheException 初始化失败
     */
    public CacheSnapshot ensureInitialized(HostLifecycle hostLifecycle) {
        // 快速路径：无锁读取，先取快照再看状态
        CacheSnapshot current = snapshot;
        if (current.root() != null && state == InitializationState.READY) {
            return current;
        }

        gate.lock();
        try {
            // 二次检查：等待期间其他线程可能已完成
            if (state != InitializationState.READY) {
                registerTeardown(hostLifecycle);
                initialize();
            }
            return snapshot;
        } finally {
            gate.unlock();
        }
    }

    private void registerTeardown(HostLifecycle hostLifecycle) {
        if (hostLifecycle != null && registeredLifecycles.add(hostLifecycle)) {
            hostLifecycle.onShutdown(() -> onHostShutdown(hostLifecycle));
            log.debug("Registered cache teardown with host lifecycle {}", hostLifecycle);
        }
    }

    /**
     * 宿主关闭回调：回调只触发一次，之后再初始化需要重新注册
     */
    private void onHostShutdown(HostLifecycle hostLifecycle) {
        gate.lock();
        try {
            registeredLifecycles.remove(hostLifecycle);
            teardown();
        } finally {
            gate.unlock();
        }
    }

    private void initialize() {
        state = InitializationState.INITIALIZING;
        long startTime = System.nanoTime();
        log.info(">>> Extracting embedded pages...");

        boolean success = false;
        try {
            CacheSnapshot built = runExtractionPass();
            snapshot = built;
            state = InitializationState.READY;
            success = true;
            completedPasses.incrementAndGet();

            Duration duration = Duration.ofNanos(System.nanoTime() - startTime);
            log.info(">>> Extracted {} embedded pages to {} in {} ms",
                built.size(), built.root(), duration.toMillis());
            notifyInitialized(built, duration);
        } catch (RuntimeException e) {
            Duration duration = Duration.ofNanos(System.nanoTime() - startTime);
            log.error(">>> Embedded page extraction failed after {} ms", duration.toMillis(), e);
            notifyFailure(e, duration);
            throw e;
        } finally {
            if (!success) {
                snapshot = CacheSnapshot.EMPTY;
                state = InitializationState.UNINITIALIZED;
            }
        }
    }

    private CacheSnapshot runExtractionPass() {
        Path root = cacheDirectory.recreate();

        List<PackageBinding> bindings = configuration == null ? null : configuration.packageBindings();
        if (bindings == null || bindings.isEmpty()) {
            log.info("No embedded page packages configured");
            return CacheSnapshot.of(root, Collections.emptyMap());
        }

        Map<String, ExtractedEntry> index = new LinkedHashMap<>();
        for (PackageBinding configured : bindings) {
            PackageBinding binding = PackageBinding
                .of(configured.packageName(), configured.namespaceRoot())
                .orElseThrow();
            try (ResourcePackage resourcePackage = loadPackage(binding.packageName())) {
                extractPackage(resourcePackage, binding, root, index);
            }
        }
        return CacheSnapshot.of(root, index);
    }

    private ResourcePackage loadPackage(String packageName) {
        ResourcePackage resourcePackage;
        try {
            resourcePackage = packageLoader.load(packageName);
        } catch (ResourceCacheException e) {
            throw e;
        } catch (RuntimeException e) {
            throw ResourceCacheException.packageLoadFailure(packageName, e);
        }
        if (resourcePackage == null) {
            throw ResourceCacheException.packageLoadFailure(packageName, null);
        }
        return resourcePackage;
    }

    private void extractPackage(ResourcePackage resourcePackage, PackageBinding binding,
                                Path root, Map<String, ExtractedEntry> index) {
        List<String> pages = resourceCatalog.listEligible(resourcePackage).orElseThrow();
        log.info("Package {} declares {} embedded pages under {}",
            binding.packageName(), pages.size(), binding.namespaceRoot());

        int extracted = 0;
        for (String resourceName : pages) {
            Path destination = pathMapper.map(binding.namespaceRoot(), resourceName, root).orElseThrow();
            String virtualPath = toVirtualPath(root, destination);
            String key = CacheSnapshot.indexKey(virtualPath);

            // 先到先得，后续同名虚拟路径直接跳过
            if (index.containsKey(key)) {
                log.debug("Skipping {} from {}, virtual path {} already extracted from {}",
                    resourceName, binding.packageName(), virtualPath, index.get(key).packageName());
                continue;
            }

            resourceExtractor.extract(resourcePackage, resourceName, destination).orElseThrow();
            index.put(key, new ExtractedEntry(virtualPath, destination, binding.packageName(), resourceName));
            extracted++;
        }
        log.debug("Extracted {} pages from {}", extracted, binding.packageName());
    }

    /**
     * 缓存根目录内的绝对路径 -> 以 / 分隔、以 / 开头的虚拟路径
     */
    static String toVirtualPath(Path root, Path destination) {
        if (!destination.startsWith(root) || destination.equals(root)) {
            throw ResourceCacheException.invalidArgument(
                "Mapped path [" + destination + "] is not inside cache root [" + root + "]");
        }
        StringJoiner joiner = new StringJoiner("/", "/", "");
        for (Path element : root.relativize(destination)) {
            joiner.add(element.toString());
        }
        return joiner.toString();
    }

    /**
     * 删除缓存目录、清空索引、回到未初始化状态；幂等
     */
    public void teardown() {
        gate.lock();
        try {
            boolean wasActive = state != InitializationState.UNINITIALIZED || cacheDirectory.isActive();
            try {
                cacheDirectory.destroy();
            } finally {
                snapshot = CacheSnapshot.EMPTY;
                state = InitializationState.UNINITIALIZED;
            }
            if (wasActive) {
                log.info("Embedded page cache torn down");
                notifyTeardown();
            }
        } finally {
            gate.unlock();
        }
    }

    /**
     * 指定快照的缓存根目录下的路径
     * @param current {@link #ensureInitialized(HostLifecycle)} 返回的快照
     */
    public Path resolveInCache(CacheSnapshot current, String relativePath) {
        if (current == null || current.root() == null) {
            throw ResourceCacheException.directoryFailure("Embedded page cache is not initialized", null);
        }
        return cacheDirectory.pathUnder(current.root(), relativePath);
    }

    public InitializationState state() {
        return state;
    }

    public boolean isReady() {
        return state == InitializationState.READY;
    }

    public CacheSnapshot snapshot() {
        return snapshot;
    }

    /** 已成功完成的提取次数 */
    public long completedPasses() {
        return completedPasses.get();
    }

    private void notifyInitialized(CacheSnapshot built, Duration duration) {
        for (InitializationListener listener : listeners) {
            try {
                listener.onInitialized(built, duration);
            } catch (RuntimeException e) {
                log.warn("Initialization listener {} failed", listener, e);
            }
        }
    }

    private void notifyFailure(Throwable cause, Duration duration) {
        for (InitializationListener listener : listeners) {
            try {
                listener.onInitializationFailure(cause, duration);
            } catch (RuntimeException e) {
                log.warn("Initialization listener {} failed", listener, e);
            }
        }
    }

    private void notifyTeardown() {
        for (InitializationListener listener : listeners) {
            try {
                listener.onTeardown();
            } catch (RuntimeException e) {
                log.warn("Initialization listener {} failed", listener, e);
            }
        }
    }
}
