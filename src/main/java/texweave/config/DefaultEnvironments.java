// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import texweave.document.EnvironmentKind;

/**
 * The built-in environment table, including the Vietnamese environment names and their display labels.
 */
final class DefaultEnvironments {
    private DefaultEnvironments() {
    }

    /**
     * Returns the built-in table for the given document language. Only {@code "vi"} changes anything: it swaps in
     * Vietnamese display labels.
     */
    static Map<String, EnvironmentStyle> forLanguage(final String language) {
        if (!language.equals("vi")) {
            return english;
        }
        final var result = new LinkedHashMap<String, EnvironmentStyle>();
        english.forEach((name, style) -> {
            final var label = vietnameseLabels.get(name);
            result.put(name, (label == null) ? style : style.withDisplayLabel(label));
        });
        return result;
    }

    private static void theorem(final String name, final String label) {
        english.put(name, EnvironmentStyle.theoremLike(name, "env-theorem", label));
    }

    private static void box(final String name, final String cssClass, final String label) {
        english.put(name, EnvironmentStyle.fromCssClass(name, cssClass, label));
    }

    private static final Map<String, EnvironmentStyle> english = new LinkedHashMap<>();
    private static final Map<String, String> vietnameseLabels = Map.ofEntries(
        Map.entry("theorem", "Định lý"),
        Map.entry("lemma", "Bổ đề"),
        Map.entry("proposition", "Mệnh đề"),
        Map.entry("corollary", "Hệ quả"),
        Map.entry("definition", "Định nghĩa"),
        Map.entry("conjecture", "Phỏng đoán"),
        Map.entry("example", "Ví dụ"),
        Map.entry("exercise", "Bài tập"),
        Map.entry("remark", "Nhận xét"),
        Map.entry("note", "Lưu ý"),
        Map.entry("proof", "Chứng minh"),
        Map.entry("dinhly", "Định lý"),
        Map.entry("bode", "Bổ đề"),
        Map.entry("menhde", "Mệnh đề"),
        Map.entry("hequa", "Hệ quả"),
        Map.entry("dinhnghia", "Định nghĩa"),
        Map.entry("giaithiet", "Giả thiết"),
        Map.entry("phongdoan", "Phỏng đoán"),
        Map.entry("vidu", "Ví dụ"),
        Map.entry("baitap", "Bài tập"),
        Map.entry("trucgiac", "Trực giác"),
        Map.entry("chungminhsocap", "Chứng minh"),
        Map.entry("chungminhnangcao", "Chứng minh (nâng cao)"),
        Map.entry("phachoa", "Phác họa"),
        Map.entry("giaithoai", "Giai thoại"),
        Map.entry("luuy", "Lưu ý"),
        Map.entry("tomtat", "Tóm tắt"),
        Map.entry("thuatngu", "Thuật ngữ")
    );

    static {
        theorem("theorem", "Theorem");
        theorem("lemma", "Lemma");
        theorem("proposition", "Proposition");
        theorem("corollary", "Corollary");
        theorem("conjecture", "Conjecture");
        box("definition", "env-definition", "Definition");
        box("example", "env-example", "Example");
        box("exercise", "env-example", "Exercise");
        box("remark", "box-yellow", "Remark");
        box("note", "box-yellow", "Note");
        box("proof", "env-proof", "Proof");

        for (final var name : List.of("dinhly", "bode", "menhde", "hequa", "giaithiet", "phongdoan")) {
            theorem(name, name);
        }
        box("dinhnghia", "env-definition", "dinhnghia");
        box("vidu", "env-example", "vidu");
        box("baitap", "env-example", "baitap");
        box("trucgiac", "box-green", "trucgiac");
        box("chungminhsocap", "env-proof", "chungminhsocap");
        box("chungminhnangcao", "box-yellow", "chungminhnangcao");
        box("phachoa", "box-red", "phachoa");
        box("giaithoai", "box-purple", "giaithoai");
        box("luuy", "box-yellow", "luuy");
        box("tomtat", "box-gray", "tomtat");
        box("thuatngu", "box-teal", "thuatngu");

        for (final var name : List.of("itemize", "enumerate", "description")) {
            english.put(name, EnvironmentStyle.unnumbered(name, EnvironmentKind.LIST, "list-" + name, name));
        }
        for (final var name : List.of(
            "center", "flushleft", "flushright", "quote", "quotation", "verse", "abstract", "minipage", "multicols",
            "small", "footnotesize"
        )) {
            english.put(name, EnvironmentStyle.unnumbered(name, EnvironmentKind.CUSTOM, "layout-" + name, name));
        }
    }
}
