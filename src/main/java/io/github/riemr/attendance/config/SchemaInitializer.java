package io.github.riemr.attendance.config;

import io.github.riemr.attendance.domain.model.LeaveCategory;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class SchemaInitializer {
    private final JdbcTemplate jdbc;

    @PostConstruct
    public void ensureTables() {
        try {
            jdbc.execute("CREATE TABLE IF NOT EXISTS employees (" +
                    "id UUID PRIMARY KEY DEFAULT gen_random_uuid(), " +
                    "employee_id VARCHAR(32) NOT NULL UNIQUE, " +
                    "full_name TEXT NOT NULL, " +
                    "hire_date DATE, " +
                    "probation_end_date DATE, " +
                    "status VARCHAR(16) NOT NULL DEFAULT 'active' " +
                    "CHECK (status IN ('active', 'inactive', 'terminated')), " +
                    "created_at TIMESTAMPTZ NOT NULL DEFAULT now(), " +
                    "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS leave_types (" +
                    "id UUID PRIMARY KEY DEFAULT gen_random_uuid(), " +
                    "name TEXT NOT NULL UNIQUE, " +
                    "is_active BOOLEAN NOT NULL DEFAULT TRUE, " +
                    "created_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS work_schedules (" +
                    "id UUID PRIMARY KEY DEFAULT gen_random_uuid(), " +
                    "employee_id UUID NOT NULL REFERENCES employees(id) ON DELETE CASCADE, " +
                    "start_time TIME NOT NULL DEFAULT '09:00', " +
                    "end_time TIME NOT NULL DEFAULT '17:00', " +
                    "minimum_daily_hours NUMERIC(4,2) NOT NULL DEFAULT 8.00, " +
                    "working_days TEXT[] NOT NULL DEFAULT ARRAY['Monday','Tuesday','Wednesday','Thursday','Friday'], " +
                    "is_active BOOLEAN NOT NULL DEFAULT TRUE, " +
                    "created_at TIMESTAMPTZ NOT NULL DEFAULT now(), " +
                    "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");
            // at most one active schedule per employee
            jdbc.execute("CREATE UNIQUE INDEX IF NOT EXISTS ux_work_schedules_active " +
                    "ON work_schedules(employee_id) WHERE is_active");
            jdbc.execute("CREATE TABLE IF NOT EXISTS attendance (" +
                    "id UUID PRIMARY KEY DEFAULT gen_random_uuid(), " +
                    "employee_id UUID NOT NULL REFERENCES employees(id) ON DELETE CASCADE, " +
                    "date DATE NOT NULL, " +
                    "clock_in_time TIMESTAMPTZ, " +
                    "clock_out_time TIMESTAMPTZ, " +
                    "total_hours NUMERIC(6,2), " +
                    "is_wfh BOOLEAN NOT NULL DEFAULT FALSE, " +
                    "notes TEXT, " +
                    "created_at TIMESTAMPTZ NOT NULL DEFAULT now(), " +
                    "UNIQUE (employee_id, date)" +
                    ")");
            // databases created with the narrower column overflow on shifts of 100 hours or more
            jdbc.execute("ALTER TABLE attendance ALTER COLUMN total_hours TYPE NUMERIC(6,2)");
            jdbc.execute("CREATE OR REPLACE FUNCTION calculate_total_hours() RETURNS TRIGGER AS $$ " +
                    "BEGIN " +
                    "IF NEW.clock_in_time IS NOT NULL AND NEW.clock_out_time IS NOT NULL THEN " +
                    "NEW.total_hours = EXTRACT(EPOCH FROM (NEW.clock_out_time - NEW.clock_in_time)) / 3600; " +
                    "END IF; " +
                    "RETURN NEW; " +
                    "END; $$ LANGUAGE plpgsql");
            jdbc.execute("DROP TRIGGER IF EXISTS calculate_hours_trigger ON attendance");
            jdbc.execute("CREATE TRIGGER calculate_hours_trigger BEFORE INSERT OR UPDATE ON attendance " +
                    "FOR EACH ROW EXECUTE FUNCTION calculate_total_hours()");
            jdbc.execute("CREATE TABLE IF NOT EXISTS attendance_exceptions (" +
                    "id UUID PRIMARY KEY DEFAULT gen_random_uuid(), " +
                    "employee_id UUID NOT NULL REFERENCES employees(id) ON DELETE CASCADE, " +
                    "target_date DATE NOT NULL, " +
                    "exception_type VARCHAR(32) NOT NULL, " +
                    "reason TEXT NOT NULL, " +
                    "proposed_clock_in TIMESTAMPTZ, " +
                    "proposed_clock_out TIMESTAMPTZ, " +
                    "status VARCHAR(16) NOT NULL DEFAULT 'pending' " +
                    "CHECK (status IN ('pending', 'approved', 'rejected')), " +
                    "created_at TIMESTAMPTZ NOT NULL DEFAULT now(), " +
                    "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS leave_requests (" +
                    "id UUID PRIMARY KEY DEFAULT gen_random_uuid(), " +
                    "employee_id UUID NOT NULL REFERENCES employees(id) ON DELETE CASCADE, " +
                    "leave_type_id UUID NOT NULL REFERENCES leave_types(id), " +
                    "start_date DATE NOT NULL, " +
                    "end_date DATE NOT NULL, " +
                    "total_days INTEGER NOT NULL, " +
                    "reason TEXT NOT NULL, " +
                    "status VARCHAR(16) NOT NULL DEFAULT 'pending' " +
                    "CHECK (status IN ('pending', 'approved', 'rejected')), " +
                    "payment_type VARCHAR(16) DEFAULT 'full_pay' " +
                    "CHECK (payment_type IN ('full_pay', 'half_pay', 'unpaid')), " +
                    "medical_certificate_url TEXT, " +
                    "relationship TEXT, " +
                    "created_at TIMESTAMPTZ NOT NULL DEFAULT now(), " +
                    "updated_at TIMESTAMPTZ NOT NULL DEFAULT now(), " +
                    "CHECK (end_date >= start_date)" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS employee_leave_balances (" +
                    "id UUID PRIMARY KEY DEFAULT gen_random_uuid(), " +
                    "employee_id UUID NOT NULL REFERENCES employees(id) ON DELETE CASCADE, " +
                    "leave_type_id UUID NOT NULL REFERENCES leave_types(id), " +
                    "year INTEGER NOT NULL, " +
                    "allocated_days INTEGER NOT NULL DEFAULT 0, " +
                    "used_days INTEGER NOT NULL DEFAULT 0, " +
                    "auto_calculated BOOLEAN NOT NULL DEFAULT FALSE, " +
                    "service_months_at_allocation INTEGER, " +
                    "created_at TIMESTAMPTZ NOT NULL DEFAULT now(), " +
                    "updated_at TIMESTAMPTZ NOT NULL DEFAULT now(), " +
                    "UNIQUE (employee_id, leave_type_id, year)" +
                    ")");

            for (LeaveCategory category : LeaveCategory.values()) {
                if (category.displayName() == null) continue;
                jdbc.update("INSERT INTO leave_types(name) VALUES (?) ON CONFLICT (name) DO NOTHING",
                        category.displayName());
            }
        } catch (Exception e) {
            log.warn("Schema initialization skipped or failed: {}", e.getMessage());
        }
    }
}
