package com.stlmonitor.collectors.feed;

import com.stlmonitor.core.model.FeedDialect;
import com.stlmonitor.core.model.FeedSource;
import com.stlmonitor.core.model.RawFeedItem;
import com.stlmonitor.core.util.HtmlUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns RSS 2.0 or Atom text into {@link RawFeedItem}s.
 *
 * <p>Well-formed documents go through a hardened DOM parser. Feeds in the wild are often not well-formed (stray
 * ampersands, HTML entities, a doctype), so anything the DOM parser refuses is scanned again with a lenient
 * pattern-based reader that applies the same field rules. Items without a title or link are dropped; an item whose
 * date cannot be read is stamped with the current time.
 */
public class FeedParser {
    private static final Logger LOGGER = Logger.getLogger(FeedParser.class.getName());

    private static final Pattern ITEM_BLOCK = block("item");
    private static final Pattern ENTRY_BLOCK = block("entry");
    private static final Pattern CDATA = Pattern.compile("<!\\[CDATA\\[(.*?)]]>", Pattern.DOTALL);
    private static final Pattern LINK_HREF = Pattern.compile(
            "<link(?=[\\s>/])[^>]*?\\bhref\\s*=\\s*[\"']([^\"']+)[\"']",
            Pattern.CASE_INSENSITIVE
    );
    private static final DateTimeFormatter LOOSE_RFC_822 =
            DateTimeFormatter.ofPattern("EEE, d MMM yyyy HH:mm:ss zzz", Locale.ENGLISH);

    private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
            Instant::parse,
            value -> OffsetDateTime.parse(value).toInstant(),
            value -> ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant(),
            value -> ZonedDateTime.parse(value, LOOSE_RFC_822).toInstant()
    );

    private final Clock clock;

    public FeedParser(Clock clock) {
        this.clock = clock;
    }

    /**
     * Reads a feed from a configured source. The declared dialect does not pick a reader: RSS items and Atom entries
     * are both read either way. A feed whose shape differs from its declared dialect is logged so the source entry
     * can be corrected.
     */
    public List<RawFeedItem> parse(String raw, FeedSource source) {
        List<RawFeedItem> items = parse(raw, source.name());
        if (!items.isEmpty()) {
            FeedDialect found = detectDialect(raw);
            if (found != source.dialect()) {
                LOGGER.warning(() -> source.name() + " is configured as " + source.dialect()
                        + " but serves " + found);
            }
        }
        return items;
    }

    static FeedDialect detectDialect(String raw) {
        return ENTRY_BLOCK.matcher(raw).find() && !ITEM_BLOCK.matcher(raw).find() ? FeedDialect.ATOM : FeedDialect.RSS;
    }

    public List<RawFeedItem> parse(String raw, String sourceName) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        Optional<Document> document = parseDocument(raw);
        List<RawFeedItem> items = document.isPresent()
                ? readDocument(document.get(), sourceName)
                : readLeniently(raw, sourceName);
        LOGGER.fine(() -> "Parsed " + items.size() + " items from " + sourceName
                + (document.isPresent() ? "" : " (lenient)"));
        return items;
    }

    private List<RawFeedItem> readDocument(Document document, String sourceName) {
        List<RawFeedItem> items = new ArrayList<>();
        NodeList rssItems = document.getElementsByTagName("item");
        for (int i = 0; i < rssItems.getLength(); i++) {
            Element item = (Element) rssItems.item(i);
            addIfComplete(items, sourceName, () -> fromRssElement(item));
        }
        NodeList atomEntries = document.getElementsByTagName("entry");
        for (int i = 0; i < atomEntries.getLength(); i++) {
            Element entry = (Element) atomEntries.item(i);
            addIfComplete(items, sourceName, () -> fromAtomElement(entry));
        }
        return items;
    }

    private List<RawFeedItem> readLeniently(String raw, String sourceName) {
        List<RawFeedItem> items = new ArrayList<>();
        Matcher rssItems = ITEM_BLOCK.matcher(raw);
        while (rssItems.find()) {
            String body = rssItems.group(1);
            addIfComplete(items, sourceName, () -> fromRssText(body));
        }
        Matcher atomEntries = ENTRY_BLOCK.matcher(raw);
        while (atomEntries.find()) {
            String body = atomEntries.group(1);
            addIfComplete(items, sourceName, () -> fromAtomText(body));
        }
        return items;
    }

    private void addIfComplete(List<RawFeedItem> items, String sourceName, ItemReader reader) {
        try {
            reader.read().ifPresent(items::add);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Skipping unreadable item from " + sourceName, e);
        }
    }

    private Optional<RawFeedItem> fromRssElement(Element item) {
        return assemble(
                childText(item, "title"),
                firstPresent(childText(item, "link"), childText(item, "guid")),
                firstPresent(childText(item, "description"), childText(item, "content:encoded"), childText(item, "content")),
                firstPresent(childText(item, "pubDate"), childText(item, "dc:date"), childText(item, "published"))
        );
    }

    private Optional<RawFeedItem> fromAtomElement(Element entry) {
        return assemble(
                childText(entry, "title"),
                firstPresent(linkHref(entry), childText(entry, "link")),
                firstPresent(childText(entry, "summary"), childText(entry, "content")),
                firstPresent(childText(entry, "updated"), childText(entry, "published"))
        );
    }

    private Optional<RawFeedItem> fromRssText(String body) {
        return assemble(
                tagText(body, "title"),
                firstPresent(tagText(body, "link"), tagText(body, "guid")),
                firstPresent(tagText(body, "description"), tagText(body, "content:encoded"), tagText(body, "content")),
                firstPresent(tagText(body, "pubDate"), tagText(body, "dc:date"), tagText(body, "published"))
        );
    }

    private Optional<RawFeedItem> fromAtomText(String body) {
        Matcher href = LINK_HREF.matcher(body);
        Optional<String> hrefLink = href.find() ? nonBlank(href.group(1)) : Optional.empty();
        return assemble(
                tagText(body, "title"),
                firstPresent(hrefLink, tagText(body, "link")),
                firstPresent(tagText(body, "summary"), tagText(body, "content")),
                firstPresent(tagText(body, "updated"), tagText(body, "published"))
        );
    }

    private Optional<RawFeedItem> assemble(
            Optional<String> title,
            Optional<String> link,
            Optional<String> description,
            Optional<String> date
    ) {
        Optional<String> cleanTitle = title.map(value -> HtmlUtils.decodeEntities(value).trim()).flatMap(FeedParser::nonBlank);
        Optional<String> cleanLink = link.map(value -> HtmlUtils.decodeEntities(value).trim()).flatMap(FeedParser::nonBlank);
        if (cleanTitle.isEmpty() || cleanLink.isEmpty()) {
            return Optional.empty();
        }
        String text = description.map(value -> HtmlUtils.stripTags(HtmlUtils.decodeEntities(value))).orElse("");
        Instant publishedAt = date.flatMap(FeedParser::parseDate).orElseGet(clock::instant);
        return Optional.of(new RawFeedItem(cleanTitle.get(), cleanLink.get(), text, publishedAt));
    }

    static Optional<Instant> parseDate(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return DATE_PARSERS.stream()
                .map(parser -> safelyParse(parser, trimmed))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .findFirst();
    }

    private static Optional<Instant> safelyParse(Function<String, Instant> parser, String value) {
        try {
            return Optional.of(parser.apply(value));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private static Optional<Document> parseDocument(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setExpandEntityReferences(false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException exception) {
                }

                @Override
                public void error(SAXParseException exception) throws SAXParseException {
                    throw exception;
                }

                @Override
                public void fatalError(SAXParseException exception) throws SAXParseException {
                    throw exception;
                }
            });
            return Optional.of(builder.parse(new InputSource(new StringReader(xml.trim()))));
        } catch (SAXException | IOException e) {
            LOGGER.fine(() -> "Feed is not well-formed XML, falling back to lenient reader: " + e.getMessage());
            return Optional.empty();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support hardened configuration", e);
        }
    }

    private static Optional<String> childText(Element parent, String tagName) {
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node instanceof Element child && tagName.equals(child.getTagName())) {
                return nonBlank(child.getTextContent());
            }
        }
        return Optional.empty();
    }

    private static Optional<String> linkHref(Element entry) {
        for (Node node = entry.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node instanceof Element child && "link".equals(child.getTagName())) {
                Optional<String> href = nonBlank(child.getAttribute("href"));
                if (href.isPresent()) {
                    return href;
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<String> tagText(String body, String tagName) {
        Matcher matcher = element(tagName).matcher(body);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return nonBlank(CDATA.matcher(matcher.group(1)).replaceAll("$1"));
    }

    @SafeVarargs
    private static Optional<String> firstPresent(Optional<String>... candidates) {
        for (Optional<String> candidate : candidates) {
            if (candidate.isPresent()) {
                return candidate;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    private static Pattern block(String tagName) {
        return Pattern.compile("<" + tagName + "(?=[\\s>])[^>]*>(.*?)</" + tagName + ">",
                Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    }

    private static Pattern element(String tagName) {
        String quoted = Pattern.quote(tagName);
        return Pattern.compile("<" + quoted + "(?=[\\s>/])[^>]*>(.*?)</" + quoted + "\\s*>",
                Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    }

    @FunctionalInterface
    private interface ItemReader {
        Optional<RawFeedItem> read();
    }
}
