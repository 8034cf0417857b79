package io.dagport.cli;

import com.beust.jcommander.ParameterException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class ParameterValidatorTest
{
    @Test
    public void splitAtFirstEquals()
    {
        assertThat(ParameterValidator.toMap(ImmutableList.of("a=1", "b=x=y", "a=2")),
                is(ImmutableMap.of("a", "2", "b", "x=y")));
    }

    @Test
    public void valueWithoutEqualsContinuesPreviousValue()
    {
        assertThat(ParameterValidator.toMap(ImmutableList.of("hosts=a", "b", "c")),
                is(ImmutableMap.of("hosts", "a,b,c")));
    }

    @Test(expected = ParameterException.class)
    public void rejectLeadingValueWithoutKey()
    {
        ParameterValidator.toMap(ImmutableList.of("value"));
    }

    @Test(expected = ParameterException.class)
    public void validateRejectsValueWithoutEquals()
    {
        new ParameterValidator().validate("-p", "value");
    }

    @Test
    public void configPathFollowsXdg()
    {
        assertThat(ConfigUtil.defaultConfigPath(ImmutableMap.of("XDG_CONFIG_HOME", "/etc/xdg")).toString(),
                is("/etc/xdg/dagport/config"));
    }
}
