package io.github.yok.cdflib.db;

import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;

/**
 * Turns a SQL template and the pending parameters into an executable statement.
 *
 * <p>
 * Placeholders are consumed strictly left to right, one parameter each. A mismatch in either
 * direction raises {@link ParameterCountException} before anything is returned.
 * </p>
 *
 * <pre>
 * template:   select * from Users where Username=? AND Type=?
 * parameters: (STRING, "foo"), (INTEGER, 12345)
 * result:     select * from Users where Username='foo' AND Type=12345
 * </pre>
 */
@RequiredArgsConstructor
public class SqlTemplate {

    private final SqlValueFormatter formatter;

    /**
     * Substitutes every placeholder of {@code sql} with the next parameter.
     *
     * @param sql template text
     * @param parameters pending parameters, in binding order
     * @return executable statement
     * @throws ParameterCountException if placeholders and parameters do not pair up
     */
    public String render(String sql, List<QueryParameter> parameters)
            throws ParameterCountException {
        int paramCount = parameters.size();
        int paramPosition = 0;
        StringBuilder sb = new StringBuilder(sql.length() + paramCount * 8);
        int from = 0;
        for (;;) {
            int token = sql.indexOf(SqlValueFormatter.PLACEHOLDER, from);
            if (token < 0) {
                break;
            }
            if (paramPosition == paramCount) {
                throw new ParameterCountException(ParameterCountException.Kind.MISSING_PARAMETER,
                        paramCount, paramPosition, sql);
            }
            QueryParameter param = parameters.get(paramPosition++);
            sb.append(sql, from, token).append(formatter.format(param.getType(), param.getValue()));
            from = token + 1;
        }
        if (paramPosition != paramCount) {
            throw new ParameterCountException(ParameterCountException.Kind.TOO_MANY_PARAMETERS,
                    paramCount, paramPosition, sql);
        }
        sb.append(sql, from, sql.length());
        return formatter.restorePlaceholders(sb.toString());
    }

    /**
     * Builds a stored procedure call with the parameters appended positionally.
     *
     * @param name procedure name
     * @param parameters pending parameters, in argument order
     * @return {@code call `name`(arg1, arg2, ...)}
     */
    public String renderCall(String name, List<QueryParameter> parameters) {
        String args = parameters.stream().map(p -> formatter.format(p.getType(), p.getValue()))
                .collect(Collectors.joining(", "));
        return formatter.restorePlaceholders(String.format("call `%s`(%s)", name, args));
    }
}
