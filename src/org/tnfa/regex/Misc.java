/*
 * @LICENSE@
 */

package org.tnfa.regex;

/**
 * This class implements a few reusable, miscelaneous static objects and
 * methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /*
     * The alphabet: plain ASCII letters, no Unicode.
     */
    static boolean isLetter(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
