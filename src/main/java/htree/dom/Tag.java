// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htree.dom;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * HTML elements known to the library, along with their rendering classification.
 * <p>
 * A tag can be a <dfn>block</dfn> tag, forcing line breaks around itself when indented, a <dfn>void</dfn> tag, which
 * never has children nor a closing tag, and a <dfn>literal-content</dfn> tag, whose children are passed through
 * verbatim. The classes are not exclusive: {@code <hr>} and {@code <meta>} are both block and void.
 */
public enum Tag {
    A(build()),
    ABBR(build()),
    ADDRESS(build().setBlock()),
    AREA(build().setVoid()),
    ARTICLE(build().setBlock()),
    ASIDE(build().setBlock()),
    AUDIO(build()),
    B(build()),
    BASE(build().setVoid()),
    BDI(build()),
    BDO(build()),
    BLOCKQUOTE(build().setBlock()),
    BODY(build().setBlock()),
    BR(build().setVoid()),
    BUTTON(build()),
    CANVAS(build()),
    CAPTION(build()),
    CITE(build()),
    CODE(build()),
    COL(build().setVoid()),
    COLGROUP(build()),
    DATA(build()),
    DATALIST(build()),
    DD(build().setBlock()),
    DEL(build()),
    DETAILS(build().setBlock()),
    DFN(build()),
    DIALOG(build().setBlock()),
    DIV(build().setBlock()),
    DL(build().setBlock()),
    DT(build().setBlock()),
    EM(build()),
    EMBED(build().setVoid()),
    FIELDSET(build().setBlock()),
    FIGCAPTION(build().setBlock()),
    FIGURE(build().setBlock()),
    FOOTER(build().setBlock()),
    FORM(build().setBlock()),
    H1(build().setBlock()),
    H2(build().setBlock()),
    H3(build().setBlock()),
    H4(build().setBlock()),
    H5(build().setBlock()),
    H6(build().setBlock()),
    HEAD(build().setBlock()),
    HEADER(build().setBlock()),
    HGROUP(build()),
    HR(build().setBlock().setVoid()),
    HTML(build().setBlock()),
    I(build()),
    IFRAME(build().setLiteralContent()),
    IMG(build().setVoid()),
    INPUT(build().setVoid()),
    INS(build()),
    KBD(build()),
    KEYGEN(build().setVoid()),
    LABEL(build()),
    LEGEND(build()),
    LI(build().setBlock()),
    LINK(build().setVoid()),
    LISTING(build()),
    MAIN(build().setBlock()),
    MAP(build()),
    MARK(build()),
    MATH(build()),
    MENU(build()),
    META(build().setBlock().setVoid()),
    METER(build()),
    NAV(build().setBlock()),
    NOEMBED(build().setLiteralContent()),
    NOFRAMES(build().setLiteralContent()),
    NOSCRIPT(build().setLiteralContent()),
    OBJECT(build()),
    OL(build().setBlock()),
    OPTGROUP(build()),
    OPTION(build()),
    OUTPUT(build()),
    P(build().setBlock()),
    PARAM(build().setVoid()),
    PICTURE(build()),
    PLAINTEXT(build().setLiteralContent()),
    PRE(build().setBlock()),
    PROGRESS(build()),
    Q(build()),
    RP(build()),
    RT(build()),
    RUBY(build()),
    S(build()),
    SAMP(build()),
    SCRIPT(build().setLiteralContent()),
    SECTION(build().setBlock()),
    SELECT(build()),
    SLOT(build()),
    SMALL(build()),
    SOURCE(build().setVoid()),
    SPAN(build()),
    STRONG(build()),
    STYLE(build().setLiteralContent()),
    SUB(build()),
    SUMMARY(build().setBlock()),
    SUP(build()),
    SVG(build()),
    TABLE(build().setBlock()),
    TBODY(build()),
    TD(build()),
    TEMPLATE(build()),
    TEXTAREA(build()),
    TFOOT(build()),
    TH(build()),
    THEAD(build()),
    TIME(build()),
    TITLE(build()),
    TR(build()),
    TRACK(build().setVoid()),
    U(build()),
    UL(build().setBlock()),
    VAR(build()),
    VIDEO(build()),
    WBR(build().setVoid()),
    XMP(build().setLiteralContent());

    Tag(final Builder builder) {
        htmlName = name().toLowerCase(Locale.ROOT);
        block = builder.block;
        isVoid = builder.isVoid;
        literalContent = builder.literalContent;
    }

    /**
     * Retrieves the tag with the given HTML name, or {@code null} if one doesn't exist.
     * <p>
     * The lookup is case-insensitive.
     */
    public static @Nullable Tag byHtmlName(final String htmlName) {
        return tagsByHtmlName.get(htmlName.toLowerCase(Locale.ROOT));
    }

    /**
     * Retrieves the HTML name of the tag, always lowercase.
     */
    public String htmlName() {
        return htmlName;
    }

    /**
     * Checks whether elements with this tag get line breaks around themselves when indented.
     */
    public boolean isBlock() {
        return block;
    }

    /**
     * Checks whether elements with this tag have neither children nor a closing tag.
     */
    public boolean isVoid() {
        return isVoid;
    }

    /**
     * Checks whether the children of elements with this tag must be emitted verbatim instead of being indented.
     */
    public boolean hasLiteralContent() {
        return literalContent;
    }

    private static Builder build() {
        return new Builder();
    }

    private static final Map<String, Tag> tagsByHtmlName =
        Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(Tag::htmlName, Function.identity()));

    private final String htmlName;
    private final boolean block;
    private final boolean isVoid;
    private final boolean literalContent;

    private static final class Builder {
        private Builder setBlock() {
            block = true;
            return this;
        }

        private Builder setVoid() {
            isVoid = true;
            return this;
        }

        private Builder setLiteralContent() {
            literalContent = true;
            return this;
        }

        private boolean block = false;
        private boolean isVoid = false;
        private boolean literalContent = false;
    }
}
