package cjkreflow;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Short {@code key separator value} lines from copyright / CIP pages,
 * e.g. {@code 書名：三體} or {@code ISBN：978-7-5366-9293-0}.
 */
public final class MetadataRules {

    private static final int MAX_LINE_LENGTH = 30;

    private static final Set<String> METADATA_KEYS = Collections.unmodifiableSet(new HashSet<>(
            Arrays.asList(
                    // ===== 1. Title / Author / Publishing =====
                    "書名", "书名",
                    "作者",
                    "原著",
                    "譯者", "译者",
                    "校訂", "校订",
                    "出版社",
                    "出版時間", "出版时间",
                    "出版日期",

                    // ===== 2. Copyright / License =====
                    "版權", "版权",
                    "版權頁", "版权页",
                    "版權信息", "版权信息",

                    // ===== 3. Editor / Pricing =====
                    "責任編輯", "责任编辑",
                    "編輯", "编辑",
                    "責編", "责编",
                    "定價", "定价",

                    // ===== 4. Descriptions / Forewords =====
                    "簡介", "简介",
                    "前言",
                    "序章",
                    "終章", "终章",
                    "尾聲", "尾声",
                    "後記", "后记",

                    // ===== 5. Digital Publishing =====
                    "品牌方",
                    "出品方",
                    "授權方", "授权方",
                    "電子版權", "数字版权",
                    "掃描", "扫描",
                    "發行", "发行",
                    "OCR",

                    // ===== 6. CIP / Cataloging =====
                    "CIP",
                    "在版編目", "在版编目",
                    "分類號", "分类号",
                    "主題詞", "主题词",
                    "類型", "类型",
                    "標簽", "标签",
                    "内容標簽", "内容标签",
                    "系列",

                    // ===== 7. Publishing Cycle =====
                    "發行日", "发行日",
                    "初版",

                    // ===== 8. Common keys without variants =====
                    "ISBN"
            )
    ));

    // Derived from METADATA_KEYS; keep the key set as the single owner of this limit.
    private static final int MAX_KEY_LENGTH = maxKeyLength();

    private MetadataRules() {
    }

    public static boolean isMetadataKey(String key) {
        if (key == null)
            return false;

        String k = key.trim();
        return !k.isEmpty() && k.length() <= MAX_KEY_LENGTH && METADATA_KEYS.contains(k);
    }

    public static boolean isMetadataLine(String line) {
        if (line == null || line.trim().isEmpty())
            return false;

        if (line.length() > MAX_LINE_LENGTH)
            return false;

        int firstNonWs = PunctSets.indexOfFirstNonWhitespace(line);

        // first separator after the leading whitespace
        int idx = -1;
        for (int i = firstNonWs; i < line.length(); i++) {
            if (PunctSets.isMetadataSeparator(line.charAt(i))) {
                idx = i;
                break;
            }
        }

        int rawKeyLen = idx - firstNonWs;
        if (idx < 0 || rawKeyLen <= 0 || rawKeyLen > MAX_KEY_LENGTH)
            return false;

        // value must exist
        int j = idx + 1;
        while (j < line.length() && Character.isWhitespace(line.charAt(j)))
            j++;
        if (j >= line.length())
            return false;

        if (!isMetadataKey(line.substring(firstNonWs, idx)))
            return false;

        return !PunctSets.isDialogOpener(line.charAt(j));
    }

    private static int maxKeyLength() {
        int max = 0;
        for (String k : METADATA_KEYS) {
            max = Math.max(max, k.length());
        }
        return max;
    }
}
