package com.fhi.model_builder.fake;

/**
 * Check digit algorithms for standardized identifiers.
 *
 * <ul>
 *   <li>ISSN: weighted modulus 11 over the first seven digits (weights 8 down to 2).</li>
 *   <li>ORCID: ISO 7064 MOD 11-2 over 15 digits.</li>
 * </ul>
 * In both, a check value of 10 is written as {@code 'X'}.
 */
public final class CheckDigits
{
    public static final int ISSN_DIGITS  = 7;
    public static final int ORCID_DIGITS = 15;

    private CheckDigits()
    {}

    /**
     * @param base the seven significant digits of an ISSN
     * @return the check character, {@code '0'}-{@code '9'} or {@code 'X'}
     */
    public static char issnCheck(String base)
    {   requireDigits(base, ISSN_DIGITS);

        int sum = 0;
        for (int i = 0; i < ISSN_DIGITS; i++)
        {   sum += (8 - i) * Character.digit(base.charAt(i), 10);
        }
        int remainder = sum % 11;
        if (remainder == 0) return '0';
        if (remainder == 1) return 'X';
        return Character.forDigit(11 - remainder, 10);
    }

    /**
     * Formats seven digits as {@code NNNN-NNNC}.
     */
    public static String formatIssn(long value)
    {   String base = String.valueOf(value);
        return base.substring(0, 4) + "-" + base.substring(4) + issnCheck(base);
    }

    /**
     * @param base the 15 significant digits of an ORCID, most significant first
     * @return the check character, {@code '0'}-{@code '9'} or {@code 'X'}
     */
    public static char orcidCheck(String base)
    {   requireDigits(base, ORCID_DIGITS);

        int total = 0;
        for (int i = 0; i < ORCID_DIGITS; i++)
        {   total = (total + Character.digit(base.charAt(i), 10)) * 2;
        }
        int remainder = total % 11;
        int result    = (12 - remainder) % 11;
        return result == 10 ? 'X' : Character.forDigit(result, 10);
    }

    /**
     * Left-pads {@code value} to 15 digits and formats it as {@code NNNN-NNNN-NNNN-NNNC}.
     */
    public static String formatOrcid(long value)
    {   String base = String.format("%015d", value);
        return String.join("-",
                           base.substring(0, 4),
                           base.substring(4, 8),
                           base.substring(8, 12),
                           base.substring(12, 15) + orcidCheck(base));
    }


    private static void requireDigits(String base, int length)
    {   if (base == null || base.length() != length || !base.chars().allMatch(c -> c >= '0' && c <= '9'))
        {   throw new IllegalArgumentException("Expected " + length + " decimal digits, got: " + base);
        }
    }
}
