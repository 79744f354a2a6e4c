// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.snapshot;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The version of the agent running on a machine, on the form major.minor.micro.qualifier,
 * where unspecified numeric components are 0 and an unspecified qualifier is the empty string.
 * <p>
 * Pre-releases are written major.minor-tagN, optionally followed by .qualifier, e.g. 2.9-rc1 or 2.9-beta1.2.
 * A pre-release orders before the release with the same numbers, and pre-releases order by tag, then number.
 * Qualifiers consisting only of digits are ordered numerically.
 * <p>
 * Instances are immutable.
 *
 * @author nodeverify
 */
public final class AgentVersion implements Comparable<AgentVersion> {

    private static final Pattern preReleasePattern = Pattern.compile("(\\d+)\\.(\\d+)-([A-Za-z]+)(\\d+)(?:\\.([A-Za-z0-9]+))?");
    private static final Pattern digits = Pattern.compile("\\d+");

    private final int major;
    private final int minor;
    private final int micro;
    private final String preReleaseTag;
    private final int preReleaseNumber;
    private final String qualifier;

    public AgentVersion(int major, int minor, int micro) {
        this(major, minor, micro, "");
    }

    public AgentVersion(int major, int minor, int micro, String qualifier) {
        this(major, minor, micro, "", 0, qualifier);
    }

    private AgentVersion(int major, int minor, int micro, String preReleaseTag, int preReleaseNumber, String qualifier) {
        this.major = major;
        this.minor = minor;
        this.micro = micro;
        this.preReleaseTag = preReleaseTag;
        this.preReleaseNumber = preReleaseNumber;
        this.qualifier = qualifier == null ? "" : qualifier;
        verify();
    }

    /** Returns a pre-release of major.minor.0, e.g. 2.9-rc1 */
    public static AgentVersion preRelease(int major, int minor, String tag, int number) {
        if (tag == null || tag.isEmpty())
            throw new IllegalArgumentException("A pre-release must have a tag");
        return new AgentVersion(major, minor, 0, tag, number, "");
    }

    /**
     * Parses a version string on the form major('.'minor('.'micro('.'qualifier)?)?)?
     * or major'.'minor'-'tagN('.'qualifier)?
     *
     * @throws IllegalArgumentException if the string is empty or improperly formatted
     */
    public static AgentVersion fromString(String versionString) {
        if (versionString == null || versionString.isBlank())
            throw new IllegalArgumentException("Empty version string");

        String trimmed = versionString.trim();
        try {
            if (trimmed.contains("-")) {
                Matcher matcher = preReleasePattern.matcher(trimmed);
                if ( ! matcher.matches())
                    throw new IllegalArgumentException("Invalid pre-release version '" + versionString + "'");
                return new AgentVersion(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)), 0,
                                        matcher.group(3), Integer.parseInt(matcher.group(4)), matcher.group(5));
            }

            String[] components = trimmed.split("\\.", -1);
            if (components.length > 4)
                throw new IllegalArgumentException("Too many components in '" + versionString + "'");
            return new AgentVersion(Integer.parseInt(components[0]),
                                    components.length > 1 ? Integer.parseInt(components[1]) : 0,
                                    components.length > 2 ? Integer.parseInt(components[2]) : 0,
                                    components.length > 3 ? components[3] : "");
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid version '" + versionString + "'", e);
        }
    }

    private void verify() {
        if (major < 0)
            throw new IllegalArgumentException("Negative major in " + this);
        if (minor < 0)
            throw new IllegalArgumentException("Negative minor in " + this);
        if (micro < 0)
            throw new IllegalArgumentException("Negative micro in " + this);
        if (preReleaseNumber < 0)
            throw new IllegalArgumentException("Negative pre-release number in " + this);
        for (int i = 0; i < preReleaseTag.length(); i++) {
            if ( ! Character.isLetter(preReleaseTag.charAt(i)))
                throw new IllegalArgumentException("Invalid pre-release tag in " + this +
                                                   ": Invalid character at position " + i + " in tag");
        }
        for (int i = 0; i < qualifier.length(); i++) {
            if ( ! Character.isLetterOrDigit(qualifier.charAt(i)))
                throw new IllegalArgumentException("Invalid qualifier in " + this +
                                                   ": Invalid character at position " + i + " in qualifier");
        }
    }

    public int getMajor() { return major; }

    public int getMinor() { return minor; }

    public int getMicro() { return micro; }

    public String getQualifier() { return qualifier; }

    public boolean isPreRelease() { return ! preReleaseTag.isEmpty(); }

    /** Returns whether this version is strictly lower than the given version */
    public boolean isBefore(AgentVersion other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(AgentVersion other) {
        int result = Integer.compare(major, other.major);
        if (result != 0) return result;

        result = Integer.compare(minor, other.minor);
        if (result != 0) return result;

        result = Integer.compare(micro, other.micro);
        if (result != 0) return result;

        result = comparePreRelease(other);
        if (result != 0) return result;

        return compareQualifiers(qualifier, other.qualifier);
    }

    private int comparePreRelease(AgentVersion other) {
        if (isPreRelease() != other.isPreRelease())
            return isPreRelease() ? -1 : 1;

        int result = preReleaseTag.compareTo(other.preReleaseTag);
        if (result != 0) return result;
        return Integer.compare(preReleaseNumber, other.preReleaseNumber);
    }

    /** Numeric qualifiers compare by value, of any length; all others as strings */
    private static int compareQualifiers(String a, String b) {
        if ( ! digits.matcher(a).matches() || ! digits.matcher(b).matches())
            return a.compareTo(b);

        String strippedA = stripLeadingZeros(a);
        String strippedB = stripLeadingZeros(b);
        int result = Integer.compare(strippedA.length(), strippedB.length());
        return result != 0 ? result : strippedA.compareTo(strippedB);
    }

    private static String stripLeadingZeros(String number) {
        int start = 0;
        while (start < number.length() - 1 && number.charAt(start) == '0')
            start++;
        return number.substring(start);
    }

    @Override
    public boolean equals(Object object) {
        if ( ! (object instanceof AgentVersion other)) return false;
        return major == other.major && minor == other.minor && micro == other.micro &&
               preReleaseTag.equals(other.preReleaseTag) && preReleaseNumber == other.preReleaseNumber &&
               qualifier.equals(other.qualifier);
    }

    @Override
    public int hashCode() {
        return major * 3 + minor * 5 + micro * 7 + preReleaseTag.hashCode() * 13 + preReleaseNumber * 17 + qualifier.hashCode() * 11;
    }

    /** Returns this as major.minor.micro, followed by -tagN if it is a pre-release and .qualifier if there is one */
    @Override
    public String toString() {
        return major + "." + minor + "." + micro +
               (isPreRelease() ? "-" + preReleaseTag + preReleaseNumber : "") +
               (qualifier.isEmpty() ? "" : "." + qualifier);
    }

}
