package io.clubone.outreach.outreach.provider;

public class TaggingResult {
	private final boolean ok;
	private final boolean skipped;
	private final String error;

	private TaggingResult(boolean ok, boolean skipped, String error) {
		this.ok = ok;
		this.skipped = skipped;
		this.error = error;
	}

	public static TaggingResult ok() {
		return new TaggingResult(true, false, null);
	}

	public static TaggingResult skipped(String reason) {
		return new TaggingResult(false, true, reason);
	}

	public static TaggingResult fail(String error) {
		return new TaggingResult(false, false, error);
	}

	public boolean isOk() {
		return ok;
	}

	public boolean isSkipped() {
		return skipped;
	}

	public String getError() {
		return error;
	}
}
