package com.clapgrow.inbox.api.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.hibernate.HibernateException;
import org.hibernate.engine.spi.SharedSessionContractImplementor;
import org.hibernate.usertype.UserType;
import org.postgresql.util.PGobject;

import java.io.Serializable;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Objects;

/**
 * Maps a PostgreSQL {@code jsonb} column to a Jackson {@link JsonNode}.
 *
 * <p>Object and array columns (metadata, attachments, raw webhook payloads) share
 * this type. Nodes are mutable, so Hibernate gets deep copies for dirty checking.
 */
public class PostgreSQLJSONBType implements UserType<JsonNode> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public int getSqlType() {
        return Types.OTHER;
    }

    @Override
    public Class<JsonNode> returnedClass() {
        return JsonNode.class;
    }

    @Override
    public boolean equals(JsonNode x, JsonNode y) throws HibernateException {
        return Objects.equals(x, y);
    }

    @Override
    public int hashCode(JsonNode x) throws HibernateException {
        return x == null ? 0 : x.hashCode();
    }

    @Override
    public JsonNode nullSafeGet(ResultSet rs, int position, SharedSessionContractImplementor session, Object owner)
            throws SQLException {
        Object value = rs.getObject(position);
        if (value == null) {
            return null;
        }
        String json = value instanceof PGobject pgObject ? pgObject.getValue() : value.toString();
        return json == null ? null : parse(json);
    }

    @Override
    public void nullSafeSet(PreparedStatement st, JsonNode value, int index, SharedSessionContractImplementor session)
            throws HibernateException, SQLException {
        if (value == null || value.isNull() || value.isMissingNode()) {
            st.setNull(index, Types.OTHER);
        } else {
            PGobject pgObject = new PGobject();
            pgObject.setType("jsonb");
            pgObject.setValue(value.toString());
            st.setObject(index, pgObject, Types.OTHER);
        }
    }

    @Override
    public JsonNode deepCopy(JsonNode value) throws HibernateException {
        return value == null ? null : value.deepCopy();
    }

    @Override
    public boolean isMutable() {
        return true;
    }

    @Override
    public Serializable disassemble(JsonNode value) throws HibernateException {
        return value == null ? null : value.toString();
    }

    @Override
    public JsonNode assemble(Serializable cached, Object owner) throws HibernateException {
        return cached == null ? null : parse((String) cached);
    }

    @Override
    public JsonNode replace(JsonNode detached, JsonNode managed, Object owner) throws HibernateException {
        return deepCopy(detached);
    }

    private static JsonNode parse(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new HibernateException("Stored jsonb value is not valid JSON", e);
        }
    }
}
