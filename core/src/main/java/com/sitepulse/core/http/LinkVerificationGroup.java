package com.sitepulse.core.http;

import com.sitepulse.core.api.ILinkVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * 페이지 1건의 외부 링크 검사 묶음: 공용 풀에 제출 → 전부 join.
 * cancel() 이후 끝나지 않은 링크는 0(도달 불가)으로 보고된다.
 */
public final class LinkVerificationGroup {
    private static final Logger LOG = LoggerFactory.getLogger(LinkVerificationGroup.class);

    private final ILinkVerifier verifier;
    private final ExecutorService pool;
    private final List<Future<Integer>> futures = new ArrayList<>();
    private volatile boolean cancelled = false;

    public LinkVerificationGroup(ILinkVerifier verifier, ExecutorService pool) {
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    /** 입력 순서를 유지한 url → status */
    public Map<String, Integer> verifyAll(Collection<String> urls) {
        List<String> order = new ArrayList<>(urls);
        List<Future<Integer>> submitted = new ArrayList<>(order.size());
        synchronized (futures) {
            for (String u : order) {
                Future<Integer> f;
                try {
                    f = cancelled ? null : pool.submit(() -> verifier.checkLink(u));
                } catch (RejectedExecutionException e) {
                    LOG.warn("link check rejected for {}: {}", u, e.getMessage());
                    f = null;
                }
                submitted.add(f);
                if (f != null) futures.add(f);
            }
        }

        Map<String, Integer> out = new LinkedHashMap<>();
        for (int i = 0; i < order.size(); i++) {
            out.put(order.get(i), join(order.get(i), submitted.get(i)));
        }
        return out;
    }

    public void cancel() {
        cancelled = true;
        synchronized (futures) {
            for (Future<Integer> f : futures) f.cancel(true);
        }
    }

    private static int join(String url, Future<Integer> f) {
        if (f == null) return 0;
        try {
            return f.get(); // 각 요청은 HttpClient timeout 으로 보호됨
        } catch (CancellationException e) {
            return 0;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.warn("link check task failed for {}: {}", url, cause.toString());
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 0;
        }
    }
}
