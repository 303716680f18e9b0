// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.html;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import arbor.dom.Tag;

/**
 * The table of elements whose end tag may be omitted because a following sibling's start tag implies it.
 * <p>
 * For example, in {@code <ul><li>one<li>two</ul>} the second {@code <li>} closes the first one instead of nesting
 * inside it. End tags of enclosing elements close everything inside them regardless of this table.
 */
final class EndTagOmission {
    private EndTagOmission() {
    }

    /**
     * Returns {@code true} iff a start tag of {@code startTag} found inside {@code openElement} ends
     * {@code openElement} rather than starting a child of it.
     */
    static boolean closes(final Tag openElement, final Tag startTag) {
        final var closingTags = closingStartTags.get(openElement);
        return closingTags != null && closingTags.contains(startTag);
    }

    private static Map<Tag, Set<Tag>> buildTable() {
        final var table = new EnumMap<Tag, Set<Tag>>(Tag.class);
        table.put(Tag.P, Collections.unmodifiableSet(EnumSet.of(
            Tag.ADDRESS, Tag.ARTICLE, Tag.ASIDE, Tag.BLOCKQUOTE, Tag.DETAILS, Tag.DIR, Tag.DIV, Tag.DL, Tag.FIELDSET,
            Tag.FIGCAPTION, Tag.FIGURE, Tag.FOOTER, Tag.FORM, Tag.H1, Tag.H2, Tag.H3, Tag.H4, Tag.H5, Tag.H6,
            Tag.HEADER, Tag.HGROUP, Tag.HR, Tag.MAIN, Tag.MENU, Tag.NAV, Tag.OL, Tag.P, Tag.PRE, Tag.SECTION,
            Tag.TABLE, Tag.UL
        )));
        table.put(Tag.LI, Collections.unmodifiableSet(EnumSet.of(Tag.LI)));
        final var definitionTerms = Collections.unmodifiableSet(EnumSet.of(Tag.DT, Tag.DD));
        table.put(Tag.DT, definitionTerms);
        table.put(Tag.DD, definitionTerms);
        final var cells = Collections.unmodifiableSet(
            EnumSet.of(Tag.TD, Tag.TH, Tag.TR, Tag.TBODY, Tag.THEAD, Tag.TFOOT));
        table.put(Tag.TD, cells);
        table.put(Tag.TH, cells);
        table.put(Tag.TR, Collections.unmodifiableSet(EnumSet.of(Tag.TR, Tag.TBODY, Tag.THEAD, Tag.TFOOT)));
        final var sections = Collections.unmodifiableSet(EnumSet.of(Tag.TBODY, Tag.TFOOT));
        table.put(Tag.THEAD, sections);
        table.put(Tag.TBODY, sections);
        table.put(Tag.OPTION, Collections.unmodifiableSet(EnumSet.of(Tag.OPTION, Tag.OPTGROUP)));
        table.put(Tag.OPTGROUP, Collections.unmodifiableSet(EnumSet.of(Tag.OPTGROUP)));
        final var rubyAnnotations = Collections.unmodifiableSet(EnumSet.of(Tag.RT, Tag.RP));
        table.put(Tag.RT, rubyAnnotations);
        table.put(Tag.RP, rubyAnnotations);
        return Collections.unmodifiableMap(table);
    }

    private static final Map<Tag, Set<Tag>> closingStartTags = buildTable();
}
