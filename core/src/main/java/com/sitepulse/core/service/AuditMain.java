package com.sitepulse.core.service;

import com.sitepulse.core.model.AuditConfig;
import com.sitepulse.core.model.SiteAuditResult;
import com.sitepulse.core.util.LoggingConfigurator;
import com.sitepulse.core.util.YamlConfigLoader;

import java.nio.file.Path;
import java.util.List;

/**
 * 콘솔 진입점: {@code AuditMain [audit.yml] [logLevel]}
 * 인자가 없으면 작업 디렉터리의 audit.yml 을 쓴다.
 * 종료 코드: 0 = 전체 성공, 1 = 일부 사이트 실패, 2 = 설정 오류.
 */
public final class AuditMain {
    private AuditMain() {}

    public static void main(String[] args) {
        AuditConfig cfg;
        try {
            cfg = (args.length > 0) ? YamlConfigLoader.load(Path.of(args[0])) : YamlConfigLoader.loadDefault();
        } catch (Exception e) {
            System.err.println("config error: " + e.getMessage());
            System.exit(2);
            return;
        }

        String level = args.length > 1 ? args[1] : "INFO";
        LoggingConfigurator.init(cfg.getOutputDir().resolve("logs"),
                LoggingConfigurator.levelOf(level), 5 * 1024 * 1024, 5);

        List<SiteAuditResult> results = new AuditService(cfg).runAll(
                (r, done, total) -> System.out.printf("[%d/%d] %s %s%n", done, total, r.getName(),
                        r.isSuccess() ? "ok" : "failed: " + r.getError()));

        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        System.exit(failed == 0 ? 0 : 1);
    }
}
