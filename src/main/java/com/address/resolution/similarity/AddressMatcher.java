package com.address.resolution.similarity;

import com.address.resolution.core.model.AddressNode;
import com.address.resolution.core.model.FieldMatch;
import com.address.resolution.core.model.MatchSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates the fields of a candidate address inside a free-text query.
 *
 * <p>All positions are code point offsets into the query.</p>
 */
public class AddressMatcher {

    /**
     * A building number or range right after a street name, e.g. {@code 99號}, {@code 591-593號},
     * {@code 12至14號}.
     */
    static final Pattern BUILDING_NO = Pattern.compile("([0-9A-z]+)[至及\\-]*([0-9A-z]*)號");

    private static final Pattern TOKEN = Pattern.compile("(?U)\\S+");

    /** Remaining values this short are not worth matching. */
    private static final int MIN_SUFFIX_LENGTH = 3;

    /**
     * Finds {@code value} in {@code address}, dropping leading code points of the value until
     * what is left occurs in the address. Handles provider values carrying a qualifier the
     * query leaves out, e.g. {@code 港鐵兆康站} against {@code 兆康站}.
     *
     * <p>Gives up once the remainder is at most three code points long or half of the value
     * has been dropped. Goodness is 1 for the full value and 0 when half of it was used.</p>
     */
    public FieldMatch matchText(String address, String fieldName, String value) {
        int[] codePoints = value.codePoints().toArray();
        int length = codePoints.length;

        for (int i = 0; i < length; i++) {
            String suffix = new String(codePoints, i, length - i);
            int found = address.indexOf(suffix);
            if (found >= 0) {
                int start = address.codePointCount(0, found);
                int matched = length - i;
                double goodness = ((double) matched / length - 0.5) * 2;
                return new FieldMatch(fieldName, value, new MatchSpan(start, start + matched), goodness);
            }

            if (length - i <= MIN_SUFFIX_LENGTH) break;
            if (i >= length / 2) break;
        }
        return FieldMatch.unmatched(fieldName, value);
    }

    /**
     * Matches a street or village block: its name, then the building number written right
     * after the name in the query.
     *
     * <p>Only the last whitespace-separated token of the name is searched for, because the
     * provider may prefix it with an area (e.g. {@code 屯門 青麟路}). A building number found
     * in the query is discarded when its range does not overlap the candidate's range. Ranges
     * are compared as strings, not numbers.</p>
     */
    public List<FieldMatch> matchStreetOrVillage(String address, AddressNode.StreetOrVillage node) {
        List<FieldMatch> matches = new ArrayList<>();

        String key = node.nameKey();
        FieldMatch nameMatch = matchText(address, key, lastToken(node));
        matches.add(nameMatch);

        String candidateFrom = node.buildingNoFrom();
        if (candidateFrom == null || candidateFrom.isEmpty()) {
            return matches;
        }

        MatchSpan numberSpan = null;
        String queryFrom = "";
        String queryTo = "";

        if (nameMatch.isMatched()) {
            int nameEnd = nameMatch.span().end();
            String rest = address.substring(address.offsetByCodePoints(0, nameEnd));
            Matcher matcher = BUILDING_NO.matcher(rest);
            if (matcher.lookingAt()) {
                numberSpan = new MatchSpan(
                        rest.codePointCount(0, matcher.start()),
                        rest.codePointCount(0, matcher.end())).shift(nameEnd);
                queryFrom = matcher.group(1);
                queryTo = matcher.group(2);
            }
        }

        String candidateTo = node.buildingNoTo();
        if (candidateTo == null || candidateTo.isEmpty()) candidateTo = candidateFrom;
        if (queryTo.isEmpty()) queryTo = queryFrom;

        if (candidateTo.compareTo(queryFrom) < 0 || candidateFrom.compareTo(queryTo) > 0) {
            numberSpan = null;
        }

        matches.add(new FieldMatch(AddressNode.StreetOrVillage.BUILDING_NO_FROM, candidateFrom, numberSpan,
                queryFrom.equals(candidateFrom) ? 1.0 : 0.5));
        if (node.buildingNoTo() != null) {
            matches.add(new FieldMatch(AddressNode.StreetOrVillage.BUILDING_NO_TO, candidateTo, numberSpan,
                    queryTo.equals(candidateTo) ? 1.0 : 0.5));
        }
        return matches;
    }

    /**
     * Matches every scalar field under {@code node}, depth first, in document order.
     * Leaves that are not strings are skipped.
     */
    public List<FieldMatch> matchTree(String address, AddressNode.Group node) {
        List<FieldMatch> matches = new ArrayList<>();
        for (AddressNode child : node.children()) {
            if (child instanceof AddressNode.StreetOrVillage street) {
                matches.addAll(matchStreetOrVillage(address, street));
            } else if (child instanceof AddressNode.Group group) {
                matches.addAll(matchTree(address, group));
            } else if (child instanceof AddressNode.Text text) {
                matches.add(matchText(address, text.name(), text.value()));
            }
        }
        return matches;
    }

    private static String lastToken(AddressNode.StreetOrVillage node) {
        Matcher matcher = TOKEN.matcher(node.nameValue());
        String last = null;
        while (matcher.find()) {
            last = matcher.group();
        }
        if (last == null) {
            throw new IllegalArgumentException(node.name() + " has a blank " + node.nameKey());
        }
        return last;
    }
}
