package cjkreflow;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Chapter / title heading detection (第N章 / 卷N / 序章 / 番外 ...).
 */
public final class TitleHeadingRules {

    /**
     * Chapter / heading detection.
     * <p>
     * Lines containing a comma or longer than 50 chars are never titles.
     * A chapter keyword directly followed by 分 / 合 / 的 is prose ("第三部分", "第二回合").
     */
    private static final Pattern TITLE_HEADING_REGEX = Pattern.compile(
            "^(?![^\\n]*[,，])(?=.{0,50}$)"
                    + "(?:前言|序章|楔子|终章|終章|尾声|后记|尾聲|後記|番外.{0,15}"
                    + "|.{0,10}?第.{0,5}?[章节部卷節回](?![分合的])"
                    + "|(?:卷|章)[一二三四五六七八九十](?:$|.{0,20}?))"
    );

    private TitleHeadingRules() {
    }

    /**
     * @param probe line with indentation removed
     */
    public static boolean isTitleHeading(String probe) {
        if (probe == null || probe.isEmpty())
            return false;
        return TITLE_HEADING_REGEX.matcher(probe).find();
    }

    public static boolean isCustomTitleHeading(String probe, Pattern custom) {
        if (custom == null || probe == null || probe.isEmpty())
            return false;
        return custom.matcher(probe).find();
    }

    /**
     * Compiles a user supplied title pattern.
     *
     * @return the compiled pattern, or {@code null} for a null / blank regex
     * @throws IllegalArgumentException if the regex does not compile
     */
    public static Pattern compileCustom(String regex) {
        if (regex == null || regex.trim().isEmpty())
            return null;

        try {
            return Pattern.compile(regex.trim());
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid custom title heading regex: " + regex, e);
        }
    }
}
