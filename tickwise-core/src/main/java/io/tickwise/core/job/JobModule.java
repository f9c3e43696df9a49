package io.tickwise.core.job;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.tickwise.core.schedule.ScheduleManager;

public class JobModule
    implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(ScheduleManager.class).in(Scopes.SINGLETON);
        binder.bind(JobFactory.class).in(Scopes.SINGLETON);
    }
}
