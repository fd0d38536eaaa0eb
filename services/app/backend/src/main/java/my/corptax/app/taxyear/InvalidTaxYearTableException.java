package my.corptax.app.taxyear;

import java.util.List;

public class InvalidTaxYearTableException extends IllegalStateException {
	private final List<String> errors;

	public InvalidTaxYearTableException(List<String> errors) {
		super("Invalid tax-year table: " + String.join("; ", errors));
		this.errors = List.copyOf(errors);
	}

	public InvalidTaxYearTableException(String message, Throwable cause) {
		super(message, cause);
		this.errors = List.of(message);
	}

	public List<String> getErrors() {
		return errors;
	}
}
