package io.github.riemr.attendance.infrastructure.mapper.typehandler;

import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;
import org.apache.ibatis.type.MappedJdbcTypes;
import org.apache.ibatis.type.MappedTypes;

import java.sql.Array;
import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Maps the text[] working_days column to an ordered set of weekday names.
 */
@MappedTypes(Set.class)
@MappedJdbcTypes(JdbcType.ARRAY)
public class WorkingDaysTypeHandler extends BaseTypeHandler<Set<String>> {

    @Override
    public void setNonNullParameter(PreparedStatement ps, int i, Set<String> parameter, JdbcType jdbcType)
            throws SQLException {
        Array array = ps.getConnection().createArrayOf("text", parameter.toArray());
        ps.setArray(i, array);
    }

    @Override
    public Set<String> getNullableResult(ResultSet rs, String columnName) throws SQLException {
        return toSet(rs.getArray(columnName));
    }

    @Override
    public Set<String> getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
        return toSet(rs.getArray(columnIndex));
    }

    @Override
    public Set<String> getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
        return toSet(cs.getArray(columnIndex));
    }

    private Set<String> toSet(Array array) throws SQLException {
        if (array == null) return null;
        try {
            Object[] values = (Object[]) array.getArray();
            Set<String> result = new LinkedHashSet<>();
            Arrays.stream(values)
                    .filter(v -> v != null)
                    .map(Object::toString)
                    .forEach(result::add);
            return result;
        } finally {
            array.free();
        }
    }
}
