// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.dom;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * HTML elements known to the parser.
 * <p>
 * The vocabulary is closed: markup naming anything else is rejected. It includes a number of obsolete and
 * non-standard elements still found in the wild, such as {@code <blink>} and {@code <marquee>}.
 */
public enum Tag {
    A,
    ABBR,
    ACRONYM,
    ADDRESS,
    APPLET,
    AREA(Kind.VOID),
    ARTICLE,
    ASIDE,
    AUDIO,
    B,
    BASE(Kind.VOID),
    BASEFONT,
    BDI,
    BDO,
    BGSOUND,
    BIG,
    BLINK,
    BLOCKQUOTE,
    BODY,
    BR(Kind.VOID),
    BUTTON,
    CANVAS,
    CAPTION,
    CENTER,
    CITE,
    CODE,
    COL(Kind.VOID),
    COLGROUP,
    CONTENT,
    DATA,
    DATALIST,
    DD,
    DECORATOR,
    DEL,
    DETAILS,
    DFN,
    DIR,
    DIV,
    DL,
    DT,
    ELEMENT,
    EM,
    EMBED(Kind.VOID),
    FIELDSET,
    FIGCAPTION,
    FIGURE,
    FONT,
    FOOTER,
    FORM,
    FRAME,
    FRAMESET,
    H1,
    H2,
    H3,
    H4,
    H5,
    H6,
    HEAD,
    HEADER,
    HGROUP,
    HR(Kind.VOID),
    HTML,
    I,
    IFRAME,
    IMG(Kind.VOID),
    INPUT(Kind.VOID),
    INS,
    ISINDEX,
    KBD,
    KEYGEN(Kind.VOID),
    LABEL,
    LEGEND,
    LI,
    LINK(Kind.VOID),
    LISTING,
    MAIN,
    MAP,
    MARK,
    MARQUEE,
    MENU,
    MENUITEM,
    META(Kind.VOID),
    METER,
    NAV,
    NOBR,
    NOFRAMES,
    NOSCRIPT,
    OBJECT,
    OL,
    OPTGROUP,
    OPTION,
    OUTPUT,
    P,
    PARAM(Kind.VOID),
    PLAINTEXT,
    PRE,
    PROGRESS,
    Q,
    RP,
    RT,
    RUBY,
    S,
    SAMP,
    SCRIPT,
    SECTION,
    SELECT,
    SHADOW,
    SMALL,
    SOURCE(Kind.VOID),
    SPACER,
    SPAN,
    STRIKE,
    STRONG,
    STYLE,
    SUB,
    SUMMARY,
    SUP,
    TABLE,
    TBODY,
    TD,
    TEMPLATE,
    TEXTAREA,
    TFOOT,
    TH,
    THEAD,
    TIME,
    TITLE,
    TR,
    TRACK(Kind.VOID),
    TT,
    U,
    UL,
    VAR,
    VIDEO,
    WBR(Kind.VOID),
    XMP;

    Tag() {
        this(Kind.NORMAL);
    }

    Tag(final Kind kind) {
        htmlName = name().toLowerCase(Locale.ROOT);
        this.kind = kind;
    }

    /**
     * Retrieves the tag with the given HTML name, or {@code null} if there is none.
     * <p>
     * HTML names are lowercase, and the lookup is case-sensitive: {@code "DIV"} is not a known tag.
     */
    @CheckReturnValue
    public static @Nullable Tag byHtmlName(final String htmlName) {
        return tagsByHtmlName.get(htmlName);
    }

    /**
     * Retrieves the HTML name of the tag, as it appears in markup.
     */
    public String htmlName() {
        return htmlName;
    }

    /**
     * Returns {@code true} iff this is a void element: one that never has children nor an end tag.
     */
    public boolean isVoid() {
        return kind == Kind.VOID;
    }

    @Override
    public String toString() {
        return htmlName;
    }

    private static final Map<String, Tag> tagsByHtmlName =
        Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(Tag::htmlName, Function.identity()));

    private final String htmlName;
    private final Kind kind;

    private enum Kind {
        NORMAL,
        VOID
    }
}
