package com.deviceagents.automation;

import com.deviceagents.device.LaunchableApp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * 将自然语言中的应用名或包名解析为已安装的可启动应用。
 * <p>
 * 打分顺序：包名完全相同 &gt; 应用名完全相同 &gt; 归一化后相同 &gt; 前缀 &gt; 子串 &gt; 分词重叠。
 * 包名精确匹配失败时只给出建议而不猜测；按应用名查询时取最高分作为匹配，前 5 名作为建议。
 * </p>
 */
public final class AppResolver {

    public static final int SUGGESTION_LIMIT = 5;

    private static final int PACKAGE_EXACT = 1200;
    private static final int NAME_EXACT = 1100;
    private static final int NAME_NORMALIZED = 1000;
    private static final int PACKAGE_NORMALIZED = 980;
    private static final int NAME_PREFIX = 920;
    private static final int PACKAGE_PREFIX = 880;
    private static final int NAME_SUBSTRING = 820;
    private static final int PACKAGE_SUBSTRING = 760;
    private static final int MAX_DECAY = 120;
    private static final int TOKEN_IN_NAME = 80;
    private static final int TOKEN_IN_PACKAGE = 60;

    private AppResolver() {
    }

    public static AppResolveResult resolve(List<LaunchableApp> apps, String packageNameArg, String appNameArg) {
        if (apps == null || apps.isEmpty()) {
            return AppResolveResult.none();
        }
        String pkg = packageNameArg == null ? "" : packageNameArg.trim();
        String name = appNameArg == null ? "" : appNameArg.trim();
        if (pkg.isEmpty() && name.isEmpty()) {
            return AppResolveResult.none();
        }

        if (!pkg.isEmpty()) {
            for (LaunchableApp app : apps) {
                if (app.getPackageName().equalsIgnoreCase(pkg)) {
                    return new AppResolveResult(app, Collections.<LaunchableApp>emptyList());
                }
            }
            return new AppResolveResult(null, search(apps, pkg, SUGGESTION_LIMIT));
        }

        for (LaunchableApp app : apps) {
            if (app.getAppName().equalsIgnoreCase(name)) {
                return new AppResolveResult(app, Collections.<LaunchableApp>emptyList());
            }
        }
        List<LaunchableApp> ranked = rank(apps, name);
        LaunchableApp match = ranked.isEmpty() ? null : ranked.get(0);
        return new AppResolveResult(match, ranked.subList(0, Math.min(SUGGESTION_LIMIT, ranked.size())));
    }

    /**
     * Apps scoring above zero, best first. A blank query returns the first {@code limit} apps.
     */
    public static List<LaunchableApp> search(List<LaunchableApp> apps, String query, int limit) {
        int max = Math.max(0, limit);
        String q = query == null ? "" : query.trim();
        if (q.isEmpty()) {
            return new ArrayList<>(apps.subList(0, Math.min(max, apps.size())));
        }
        List<LaunchableApp> ranked = rank(apps, q);
        return new ArrayList<>(ranked.subList(0, Math.min(max, ranked.size())));
    }

    public static String noMatchMessage(String query, List<LaunchableApp> suggestions) {
        StringBuilder sb = new StringBuilder("No launchable app matched '").append(query).append("'.");
        if (!suggestions.isEmpty()) {
            sb.append(" Suggestions: ");
            for (int i = 0; i < suggestions.size(); i++) {
                LaunchableApp app = suggestions.get(i);
                if (i > 0) sb.append(", ");
                sb.append(app.getAppName()).append(" (").append(app.getPackageName()).append(")");
            }
        }
        return sb.toString();
    }

    private static List<LaunchableApp> rank(List<LaunchableApp> apps, String query) {
        List<Scored> scored = new ArrayList<>();
        for (LaunchableApp app : apps) {
            int s = score(query, app);
            if (s > 0) {
                scored.add(new Scored(app, s));
            }
        }
        // stable sort keeps registry order among equal scores
        scored.sort(Comparator.comparingInt((Scored s) -> s.score).reversed());
        List<LaunchableApp> out = new ArrayList<>(scored.size());
        for (Scored s : scored) {
            out.add(s.app);
        }
        return out;
    }

    public static int score(String query, LaunchableApp app) {
        String normalizedQuery = normalize(query);
        if (normalizedQuery.isEmpty()) {
            return 0;
        }
        String appName = app.getAppName();
        String packageName = app.getPackageName();
        String normalizedName = normalize(appName);
        String normalizedPackage = normalize(packageName);

        if (packageName.equalsIgnoreCase(query)) return PACKAGE_EXACT;
        if (appName.equalsIgnoreCase(query)) return NAME_EXACT;
        if (normalizedName.equals(normalizedQuery)) return NAME_NORMALIZED;
        if (normalizedPackage.equals(normalizedQuery)) return PACKAGE_NORMALIZED;

        if (normalizedName.startsWith(normalizedQuery)) {
            return NAME_PREFIX - Math.min(normalizedName.length() - normalizedQuery.length(), MAX_DECAY);
        }
        if (normalizedPackage.startsWith(normalizedQuery)) {
            return PACKAGE_PREFIX - Math.min(normalizedPackage.length() - normalizedQuery.length(), MAX_DECAY);
        }
        int inName = normalizedName.indexOf(normalizedQuery);
        if (inName >= 0) {
            return NAME_SUBSTRING - Math.min(inName, MAX_DECAY);
        }
        int inPackage = normalizedPackage.indexOf(normalizedQuery);
        if (inPackage >= 0) {
            return PACKAGE_SUBSTRING - Math.min(inPackage, MAX_DECAY);
        }

        List<String> queryTokens = tokenize(query);
        List<String> nameTokens = tokenize(appName);
        List<String> packageTokens = tokenize(packageName);
        int score = 0;
        for (String token : queryTokens) {
            if (overlaps(nameTokens, token)) {
                score += TOKEN_IN_NAME;
            } else if (overlaps(packageTokens, token)) {
                score += TOKEN_IN_PACKAGE;
            }
        }
        return score;
    }

    private static boolean overlaps(List<String> tokens, String token) {
        for (String t : tokens) {
            if (t.contains(token) || token.contains(t)) {
                return true;
            }
        }
        return false;
    }

    static String normalize(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }

    static List<String> tokenize(String value) {
        List<String> tokens = new ArrayList<>();
        if (value == null) {
            return tokens;
        }
        for (String token : value.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static final class Scored {
        final LaunchableApp app;
        final int score;

        Scored(LaunchableApp app, int score) {
            this.app = app;
            this.score = score;
        }
    }
}
