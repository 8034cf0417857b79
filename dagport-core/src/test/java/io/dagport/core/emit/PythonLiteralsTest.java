package io.dagport.core.emit;

import java.util.LinkedHashMap;
import java.util.Map;
import com.google.common.collect.ImmutableList;
import org.junit.Test;

import static io.dagport.core.emit.PythonLiterals.toLiteral;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class PythonLiteralsTest
{
    @Test
    public void scalars()
    {
        assertThat(toLiteral(null), is("None"));
        assertThat(toLiteral(true), is("True"));
        assertThat(toLiteral(false), is("False"));
        assertThat(toLiteral(42), is("42"));
        assertThat(toLiteral("abc"), is("\"abc\""));
    }

    @Test
    public void stringsAreEscaped()
    {
        assertThat(toLiteral("say \"hi\"\n"), is("\"say \\\"hi\\\"\\n\""));
        assertThat(toLiteral("C:\\tmp"), is("\"C:\\\\tmp\""));
        assertThat(toLiteral("${nameNode}/path"), is("\"${nameNode}/path\""));
    }

    @Test
    public void collections()
    {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("a", "1");
        map.put("b", ImmutableList.of("x", 2, true));
        map.put("c", null);

        assertThat(toLiteral(map), is("{\"a\": \"1\", \"b\": [\"x\", 2, True], \"c\": None}"));
        assertThat(toLiteral(ImmutableList.of()), is("[]"));
    }
}
