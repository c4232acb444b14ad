package io.clubone.outreach.outreach.crm;

import io.clubone.outreach.outreach.model.Booking;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;

public class BookingRowMapper implements RowMapper<Booking> {

	@Override
	public Booking mapRow(ResultSet rs, int rowNum) throws SQLException {
		String id = rs.getString("id");
		if (id == null || id.isBlank()) {
			return null;
		}
		Booking b = new Booking();
		b.setId(id.trim());
		b.setBookingCode(blankToNull(rs.getString("booking_code")));
		b.setLeadId(blankToNull(rs.getString("lead_id")));
		b.setPaymentStatus(blankToNull(rs.getString("payment_status")));
		return b;
	}

	private static String blankToNull(String v) {
		return v == null || v.isBlank() ? null : v.trim();
	}
}
