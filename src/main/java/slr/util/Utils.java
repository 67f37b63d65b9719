package slr.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;

/**
 * Class with utility methods...
 */
public class Utils {

	/**
	 * Joins the string representations of several objects passed via a collection.
	 *
	 * @param objs passed objects
	 * @param separator separator between those representations
	 * @param <T> type of the passed objects
	 * @return joined string
	 */
	public static <T> String join(Collection<T> objs, String separator){
		return objs.stream().map(Object::toString).collect(Collectors.joining(separator));
	}

	/**
	 * Format the passed rows as a table with left aligned columns, the first row is the header.
	 */
	public static String formatTable(List<List<String>> rows){
		List<Integer> widths = new ArrayList<>();
		for (List<String> row : rows){
			for (int i = 0; i < row.size(); i++){
				if (widths.size() <= i){
					widths.add(0);
				}
				widths.set(i, Math.max(widths.get(i), row.get(i).length()));
			}
		}
		StringBuilder builder = new StringBuilder();
		for (int r = 0; r < rows.size(); r++){
			if (r != 0){
				builder.append("\n");
			}
			List<String> row = rows.get(r);
			StringBuilder line = new StringBuilder();
			for (int i = 0; i < row.size(); i++){
				if (i != 0){
					line.append(" | ");
				}
				line.append(Strings.padEnd(row.get(i), widths.get(i), ' '));
			}
			builder.append(CharMatcher.is(' ').trimTrailingFrom(line));
		}
		return builder.toString();
	}
}
