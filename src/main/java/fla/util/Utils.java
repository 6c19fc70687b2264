package fla.util;

import java.util.*;

/**
 * Class with utility methods...
 */
public class Utils {

	/**
	 * Join the string representations of the passed objects.
	 *
	 * @param strs joined objects
	 * @param separator inserted between two objects
	 * @return joined string
	 */
	public static <T> String join(Collection<T> strs, String separator){
		StringBuilder builder = new StringBuilder();
		int i = 0;
		for (T obj : strs){
			if (i++ != 0){
				builder.append(separator);
			}
			builder.append(obj);
		}
		return builder.toString();
	}

	/**
	 * Formats the passed identifiers in their natural order as {@code {a, b, c}}.
	 */
	public static String formatSet(Collection<String> set){
		return "{" + join(new TreeSet<>(set), ", ") + "}";
	}

	/**
	 * Splits a word into single character symbols (code point wise).
	 */
	public static List<String> splitSymbols(String word){
		List<String> symbols = new ArrayList<>(word.length());
		word.codePoints().forEach(c -> symbols.add(new String(Character.toChars(c))));
		return symbols;
	}

	/**
	 * Creates a random word over the passed alphabet, every symbol is chosen uniformly.
	 *
	 * @param alphabet used symbols, must not be empty
	 * @param minLength minimum number of symbols
	 * @param maxLength maximum number of symbols (inclusive)
	 * @param random source of randomness
	 * @return list of symbols
	 */
	public static List<String> randomWord(Collection<String> alphabet, int minLength, int maxLength, Random random){
		if (alphabet.isEmpty()){
			throw new IllegalArgumentException("Can't create a word over an empty alphabet");
		}
		if (minLength < 0 || maxLength < minLength){
			throw new IllegalArgumentException(String.format("Invalid length range [%d, %d]", minLength, maxLength));
		}
		List<String> symbols = new ArrayList<>(new TreeSet<>(alphabet));
		int length = minLength + random.nextInt(maxLength - minLength + 1);
		List<String> word = new ArrayList<>(length);
		for (int i = 0; i < length; i++){
			word.add(symbols.get(random.nextInt(symbols.size())));
		}
		return word;
	}

	/**
	 * Appends primes to the passed name until it isn't contained in any of the passed sets.
	 */
	@SafeVarargs
	public static String freshName(String name, Set<String>... usedNames){
		String ret = name;
		while (isUsed(ret, usedNames)){
			ret += "'";
		}
		return ret;
	}

	@SafeVarargs
	private static boolean isUsed(String name, Set<String>... usedNames){
		for (Set<String> set : usedNames){
			if (set.contains(name)){
				return true;
			}
		}
		return false;
	}
}
