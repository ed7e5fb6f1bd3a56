package com.fhi.model_builder.test_app.memory;

import java.util.Map;

import com.fhi.model_builder.BuilderContext;
import com.fhi.model_builder.FieldValue;
import com.fhi.model_builder.ModelBuilder;

public class BookBuilder extends ModelBuilder<Book, BookBuilder>
{
    public static final String DEFAULT_TITLE = "A Book";

    public BookBuilder(BuilderContext context)
    {   super(context, Book.class);
    }

    @Override
    protected Map<String, Object> getDefaultFields()
    {   return Map.of("title",     DEFAULT_TITLE,
                      "isbn",      FieldValue.deferred(fake()::gibberish),
                      "pages",     100,
                      "publisher", FieldValue.deferred(() -> new PublisherBuilder(getContext()).build()));
    }

    public BookBuilder withTitle(String title)
    {   return with("title", title);
    }
}
