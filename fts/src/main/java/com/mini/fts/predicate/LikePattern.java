package com.mini.fts.predicate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * SQL LIKE 模式
 * {@code %} 匹配任意长度字符序列，{@code _} 匹配单个字符，{@code \} 转义下一个字符
 */
public final class LikePattern {
    
    public static final char ESCAPE = '\\';
    
    /** 模式元素 */
    enum ElementType {
        LITERAL,
        ANY_SEQUENCE,
        ANY_CHAR
    }
    
    static final class Element {
        final ElementType type;
        final String literal;
        
        Element(ElementType type, String literal) {
            this.type = type;
            this.literal = literal;
        }
    }
    
    private final String pattern;
    
    private final List<Element> elements;
    
    private final Pattern regex;
    
    private LikePattern(String pattern, List<Element> elements) {
        this.pattern = pattern;
        this.elements = elements;
        this.regex = Pattern.compile(toRegex(elements), Pattern.DOTALL);
    }
    
    public static LikePattern compile(String pattern) {
        Objects.requireNonNull(pattern, "Pattern cannot be null");
        return new LikePattern(pattern, parse(pattern));
    }
    
    private static List<Element> parse(String pattern) {
        List<Element> elements = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == ESCAPE) {
                if (i + 1 >= pattern.length()) {
                    throw new IllegalArgumentException("LIKE pattern ends with escape character: " + pattern);
                }
                literal.append(pattern.charAt(++i));
            } else if (c == '%' || c == '_') {
                if (literal.length() > 0) {
                    elements.add(new Element(ElementType.LITERAL, literal.toString()));
                    literal.setLength(0);
                }
                elements.add(new Element(c == '%' ? ElementType.ANY_SEQUENCE : ElementType.ANY_CHAR, null));
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            elements.add(new Element(ElementType.LITERAL, literal.toString()));
        }
        return Collections.unmodifiableList(elements);
    }
    
    private static String toRegex(List<Element> elements) {
        StringBuilder sb = new StringBuilder();
        for (Element element : elements) {
            switch (element.type) {
                case LITERAL:
                    sb.append(Pattern.quote(element.literal));
                    break;
                case ANY_SEQUENCE:
                    sb.append(".*");
                    break;
                case ANY_CHAR:
                    sb.append('.');
                    break;
                default:
                    throw new IllegalStateException("Unknown element: " + element.type);
            }
        }
        return sb.toString();
    }
    
    public boolean matches(String value) {
        return regex.matcher(value).matches();
    }
    
    /**
     * 如果模式形如 {@code %literal%}（两端都不锚定，中间没有其它通配符），返回其中的字面量
     */
    public Optional<String> unanchoredLiteral() {
        if (elements.size() != 3) {
            return Optional.empty();
        }
        Element head = elements.get(0);
        Element body = elements.get(1);
        Element tail = elements.get(2);
        if (head.type == ElementType.ANY_SEQUENCE
                && body.type == ElementType.LITERAL
                && tail.type == ElementType.ANY_SEQUENCE) {
            return Optional.of(body.literal);
        }
        return Optional.empty();
    }
    
    /**
     * 转义字面量，使其在 LIKE 模式中按原样匹配
     */
    public static String escape(String literal) {
        StringBuilder sb = new StringBuilder(literal.length());
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (c == '%' || c == '_' || c == ESCAPE) {
                sb.append(ESCAPE);
            }
            sb.append(c);
        }
        return sb.toString();
    }
    
    public String getPattern() {
        return pattern;
    }
    
    @Override
    public String toString() {
        return pattern;
    }
}
