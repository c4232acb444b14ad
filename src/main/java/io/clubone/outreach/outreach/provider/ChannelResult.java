package io.clubone.outreach.outreach.provider;

public class ChannelResult {
	private final boolean ok;
	private final boolean skipped;
	private final Integer status;
	private final String error;

	public ChannelResult(boolean ok, boolean skipped, Integer status, String error) {
		this.ok = ok;
		this.skipped = skipped;
		this.status = status;
		this.error = error;
	}

	public static ChannelResult ok(Integer status) {
		return new ChannelResult(true, false, status, null);
	}

	public static ChannelResult fail(String error) {
		return new ChannelResult(false, false, null, error);
	}

	public static ChannelResult fail(int status, String error) {
		return new ChannelResult(false, false, status, error);
	}

	public static ChannelResult skipped(String error) {
		return new ChannelResult(false, true, null, error);
	}

	public boolean isOk() {
		return ok;
	}

	public boolean isSkipped() {
		return skipped;
	}

	public Integer getStatus() {
		return status;
	}

	public String getError() {
		return error;
	}
}
