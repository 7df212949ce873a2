package pargen.util;

import java.util.Collection;
import java.util.Iterator;

/**
 * Class with utility methods...
 */
public class Utils {

	private Utils() {
	}

	/**
	 * Joins the string representations of several objects passed via a collection.
	 *
	 * @param objs passed collection of objects
	 * @param separator separator between those representations
	 * @return joined string
	 */
	public static String join(Collection<?> objs, String separator){
		StringBuilder builder = new StringBuilder();
		Iterator<?> iterator = objs.iterator();
		while (iterator.hasNext()){
			builder.append(iterator.next());
			if (iterator.hasNext()){
				builder.append(separator);
			}
		}
		return builder.toString();
	}

	/**
	 * Return an escaped and quoted version of the passed string.
	 */
	public static String toPrintableRepresentation(String source) {
		StringBuilder sb = new StringBuilder("\"");
		for (char ch : source.toCharArray()) {
			switch (ch) {
				case '\0': sb.append("\\0"); break;
				case '\t': sb.append("\\t"); break;
				case '\n': sb.append("\\n"); break;
				case '\r': sb.append("\\r"); break;
				case '"': sb.append("\\\""); break;
				case '\\': sb.append("\\\\"); break;
				default:
					if (ch < ' ' || ch > '~') {
						sb.append(String.format("\\u%04x", (int) ch));
					} else {
						sb.append(ch);
					}
			}
		}
		return sb.append('"').toString();
	}
}
