package io.tickwise.standards.schedule;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.tickwise.spi.ScheduleFactory;

import java.time.Clock;

public class ScheduleModule
    implements Module
{
    @Override
    public void configure(Binder binder)
    {
        addStandardScheduleFactory(binder, OneTimeScheduleFactory.class);
        addStandardScheduleFactory(binder, IntervalScheduleFactory.class);
        addStandardScheduleFactory(binder, RandomIntervalScheduleFactory.class);
        addStandardScheduleFactory(binder, CronScheduleFactory.class);
        addStandardScheduleFactory(binder, CombinedScheduleFactory.class);
        binder.bind(ScheduleConfigHelper.class).in(Scopes.SINGLETON);
        binder.bind(Clock.class).toInstance(Clock.systemUTC());
    }

    protected void addStandardScheduleFactory(Binder binder, Class<? extends ScheduleFactory> factory)
    {
        Multibinder.newSetBinder(binder, ScheduleFactory.class)
            .addBinding().to(factory).in(Scopes.SINGLETON);
    }
}
